package com.advocacypacket.core.model;

public record SharedHazard(String type, int entityCount, double meanScore) {
}
