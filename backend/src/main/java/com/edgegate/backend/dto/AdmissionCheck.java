package com.edgegate.backend.dto;

public record AdmissionCheck(boolean allowed, String reason) {}
