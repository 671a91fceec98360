package com.fixfinder.backend.job;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobLocation {

    @Column(name = "location_address")
    private String address;

    @Column(name = "location_city")
    private String city;

    @Column(name = "location_state")
    private String state;

    @Column(name = "location_lat")
    private Double latitude;

    @Column(name = "location_lng")
    private Double longitude;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
