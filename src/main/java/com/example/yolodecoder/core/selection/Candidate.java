package com.example.yolodecoder.core.selection;

import com.example.yolodecoder.core.geometry.CenterBox;

record Candidate(int classId, CenterBox box, double score) {
}
