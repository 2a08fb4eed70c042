package com.zonecast.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Partial update of a {@link SpaceUser}. {@code null} fields are left untouched.
 */
@Value
@Builder
public class SpaceUserUpdate {
    String name;
    AvailabilityStatus availabilityStatus;
    Boolean cameraState;
    Boolean microphoneState;
    Boolean screenSharing;
    Boolean megaphoneState;
    List<String> tags;
    String visitCardUrl;

    public SpaceUser applyTo(SpaceUser user) {
        SpaceUser.SpaceUserBuilder builder = user.toBuilder();
        if (name != null) {
            builder.name(name);
        }
        if (availabilityStatus != null) {
            builder.availabilityStatus(availabilityStatus);
        }
        if (cameraState != null) {
            builder.cameraState(cameraState);
        }
        if (microphoneState != null) {
            builder.microphoneState(microphoneState);
        }
        if (screenSharing != null) {
            builder.screenSharing(screenSharing);
        }
        if (megaphoneState != null) {
            builder.megaphoneState(megaphoneState);
        }
        if (tags != null) {
            builder.tags(List.copyOf(tags));
        }
        if (visitCardUrl != null) {
            builder.visitCardUrl(visitCardUrl);
        }
        return builder.build();
    }

    /**
     * Names of the fields this update sets, in declaration order.
     */
    public List<String> updatedFields() {
        List<String> fields = new ArrayList<>();
        if (name != null) {
            fields.add("name");
        }
        if (availabilityStatus != null) {
            fields.add("availabilityStatus");
        }
        if (cameraState != null) {
            fields.add("cameraState");
        }
        if (microphoneState != null) {
            fields.add("microphoneState");
        }
        if (screenSharing != null) {
            fields.add("screenSharing");
        }
        if (megaphoneState != null) {
            fields.add("megaphoneState");
        }
        if (tags != null) {
            fields.add("tags");
        }
        if (visitCardUrl != null) {
            fields.add("visitCardUrl");
        }
        return fields;
    }

    public boolean isEmpty() {
        return updatedFields().isEmpty();
    }
}
