package com.example.inventorytasks.exception;

import lombok.Getter;

@Getter
public class PartNotFoundException extends RuntimeException {

    private final Long partId;

    public PartNotFoundException(Long partId) {
        super("Part not found: " + partId);
        this.partId = partId;
    }
}
