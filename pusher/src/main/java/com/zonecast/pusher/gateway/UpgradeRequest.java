package com.zonecast.pusher.gateway;

import com.zonecast.core.model.AvailabilityStatus;
import com.zonecast.core.model.Viewport;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Validated query parameters of a room socket upgrade, plus the request headers the gateway uses.
 */
@Value
@Builder(toBuilder = true)
public class UpgradeRequest {
    String roomId;
    String token;
    String name;
    @Singular
    List<String> characterTextureIds;
    String companionTextureId;
    int x;
    int y;
    Viewport viewport;
    AvailabilityStatus availabilityStatus;
    String lastCommandId;
    String version;
    String ipAddress;
    String locale;

    /**
     * Parses and validates a request URI.
     *
     * @throws InvalidUpgradeRequestException when a required parameter is absent or not a number
     */
    public static UpgradeRequest parse(String uri, String ipAddress, String locale) {
        Map<String, List<String>> params = new QueryStringDecoder(uri).parameters();

        List<String> textures = params.get("characterTextureIds");
        if (textures == null || textures.isEmpty()) {
            textures = params.get("characterTextureIds[]");
        }
        if (textures == null || textures.isEmpty()) {
            throw new InvalidUpgradeRequestException("Missing parameter characterTextureIds");
        }

        int status = requiredInt(params, "availabilityStatus");
        AvailabilityStatus availability = AvailabilityStatus.fromCode(status)
            .orElseThrow(() -> new InvalidUpgradeRequestException("Unknown availabilityStatus " + status));

        return UpgradeRequest.builder()
            .roomId(required(params, "roomId"))
            .token(optional(params, "token"))
            .name(required(params, "name"))
            .characterTextureIds(textures)
            .companionTextureId(optional(params, "companionTextureId"))
            .x(requiredCoordinate(params, "x"))
            .y(requiredCoordinate(params, "y"))
            .viewport(new Viewport(
                requiredCoordinate(params, "top"),
                requiredCoordinate(params, "right"),
                requiredCoordinate(params, "bottom"),
                requiredCoordinate(params, "left")))
            .availabilityStatus(availability)
            .lastCommandId(optional(params, "lastCommandId"))
            .version(required(params, "version"))
            .ipAddress(ipAddress)
            .locale(locale)
            .build();
    }

    private static String optional(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    private static String required(Map<String, List<String>> params, String name) {
        String value = optional(params, name);
        if (value == null) {
            throw new InvalidUpgradeRequestException("Missing parameter " + name);
        }
        return value;
    }

    private static int requiredInt(Map<String, List<String>> params, String name) {
        String value = required(params, name);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidUpgradeRequestException("Parameter " + name + " is not a number: " + value);
        }
    }

    /**
     * Clients send map coordinates as floats; the fractional part is dropped.
     */
    private static int requiredCoordinate(Map<String, List<String>> params, String name) {
        String value = required(params, name);
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidUpgradeRequestException("Parameter " + name + " is not a number: " + value);
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new InvalidUpgradeRequestException("Parameter " + name + " is not a number: " + value);
        }
        return (int) parsed;
    }
}
