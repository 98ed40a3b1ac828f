package com.example.yolodecoder;

import com.example.yolodecoder.config.DetectionProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "YOLO Output Decoder API",
                version = "1.0",
                description = "REST API turning raw single-shot detector output tensors into labeled, de-duplicated bounding boxes.",
                contact = @Contact(name = "YOLO Output Decoder")))
@SpringBootApplication
@EnableConfigurationProperties(DetectionProperties.class)
public class YoloDecoderApplication {

    public static void main(String[] args) {
        SpringApplication.run(YoloDecoderApplication.class, args);
    }
}
