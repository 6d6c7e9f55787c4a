package com.example.campaign.shared.exception;

import lombok.Getter;

/**
 * A segment filter or value lookup named a dimension the catalog does not register.
 */
@Getter
public class UnknownDimensionException extends RuntimeException {

    private final String dimensionId;

    public UnknownDimensionException(String dimensionId) {
        super("Unknown segment dimension: " + dimensionId);
        this.dimensionId = dimensionId;
    }
}
