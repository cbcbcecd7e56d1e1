package com.athena.creatorservice.common.dto;

public record DeletedResource(Long id) {}
