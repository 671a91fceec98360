package com.fixfinder.backend.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Stored form of a message body. Exactly one branch is populated, matching
 * {@link MessageType#branch()}; build instances through the static factories.
 */
@Embeddable
@Data
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageContent {

    public static final int MAX_TEXT = 1000;

    @Column(name = "content_text", length = MAX_TEXT)
    private String text;

    @Column(name = "location_lat")
    private Double latitude;

    @Column(name = "location_lng")
    private Double longitude;

    @Column(name = "location_accuracy")
    private Double accuracy;

    @Column(name = "location_label")
    private String label;

    @Column(name = "location_timestamp")
    private Instant locatedAt;

    @Column(name = "contact_name")
    private String contactName;

    @Column(name = "contact_phone")
    private String contactPhone;

    @Column(name = "contact_email")
    private String contactEmail;

    public static MessageContent text(String text) {
        MessageContent c = new MessageContent();
        c.text = text;
        return c;
    }

    public static MessageContent location(double latitude, double longitude, Double accuracy, String label, Instant locatedAt) {
        MessageContent c = new MessageContent();
        c.latitude = latitude;
        c.longitude = longitude;
        c.accuracy = accuracy;
        c.label = label;
        c.locatedAt = locatedAt;
        return c;
    }

    public static MessageContent contact(String name, String phone, String email) {
        MessageContent c = new MessageContent();
        c.contactName = name;
        c.contactPhone = phone;
        c.contactEmail = email;
        return c;
    }

    @JsonIgnore
    public Set<ContentKind> populatedBranches() {
        Set<ContentKind> kinds = EnumSet.noneOf(ContentKind.class);
        if (text != null) kinds.add(ContentKind.TEXT);
        if (latitude != null || longitude != null) kinds.add(ContentKind.LOCATION);
        if (contactName != null || contactPhone != null || contactEmail != null) kinds.add(ContentKind.CONTACT);
        return kinds;
    }
}
