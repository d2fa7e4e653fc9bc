package com.funnelduck.funnel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnelduck.exception.BadRequestException;

/**
 * Reads {@link FunnelRequest}s from JSON.
 *
 * <p>Validation errors raised while the request is being constructed keep
 * their own message; any other malformed input is reported as a
 * {@link BadRequestException} with Jackson's description of the problem.
 */
public final class FunnelRequestParser {

    private final ObjectMapper mapper;

    public FunnelRequestParser() {
        this(new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public FunnelRequestParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public FunnelRequest parse(String json) {
        try {
            return mapper.readValue(json, FunnelRequest.class);
        } catch (JsonProcessingException e) {
            for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
                if (t instanceof BadRequestException) {
                    throw (BadRequestException) t;
                }
            }
            throw new BadRequestException("Malformed funnel request: " + e.getOriginalMessage(), e);
        }
    }
}
