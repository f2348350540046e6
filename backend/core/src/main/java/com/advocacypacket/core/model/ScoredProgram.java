package com.advocacypacket.core.model;

public record ScoredProgram(ProgramRecord program, double score) {
    public String programId() {
        return program.id();
    }
}
