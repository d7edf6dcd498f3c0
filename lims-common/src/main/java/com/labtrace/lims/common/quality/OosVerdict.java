package com.labtrace.lims.common.quality;

public record OosVerdict(boolean outOfSpecification, String message) {}
