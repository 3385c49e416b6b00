package com.tradingarena.orchestrator.controller.dto;

import java.math.BigDecimal;

public record CeilingUpdateRequest(BigDecimal ceiling) {}
