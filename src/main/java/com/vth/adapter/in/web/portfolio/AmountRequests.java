package com.vth.adapter.in.web.portfolio;

import com.vth.adapter.in.web.ErrorResponses;
import com.vth.adapter.in.web.dto.AmountRequest;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Body parsing shared by the deposit and trade handlers
 */
@Slf4j
public final class AmountRequests {

    private AmountRequests() {
    }

    /**
     * @return the request, or null after a 400 response has been sent
     */
    public static AmountRequest parse(RoutingContext context) {
        AmountRequest request;
        try {
            JsonObject body = context.body().asJsonObject();
            if (body == null) {
                log.warn("Request body is null");
                ErrorResponses.sendError(context, 400, "BAD_REQUEST", "Request body is required");
                return null;
            }
            request = body.mapTo(AmountRequest.class);
        } catch (IllegalArgumentException | DecodeException e) {
            log.warn("Error parsing request body: {}", e.getMessage());
            ErrorResponses.sendError(context, 400, "BAD_REQUEST", "Invalid request format: " + e.getMessage());
            return null;
        }
        if (request.currency() == null || request.currency().isBlank()) {
            ErrorResponses.sendError(context, 400, "BAD_REQUEST", "Field 'currency' is required");
            return null;
        }
        return request;
    }
}
