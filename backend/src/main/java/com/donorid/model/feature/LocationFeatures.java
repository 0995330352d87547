package com.donorid.model.feature;

import com.donorid.model.enums.LocationCategory;

import java.util.Set;

/**
 * ADT-derived features of a stay.
 *
 * @param locationAtDeath          location occupied at the death time
 * @param locationsVisited         every location category recorded during the stay
 * @param firstAdmissionLocation   location of the earliest ADT row
 * @param hospitalLengthOfStayDays first in to last out, in days
 * @param firstIcuLengthOfStayDays length of the first ICU stay, in days
 */
public record LocationFeatures(
    FeatureValue<LocationCategory> locationAtDeath,
    Set<LocationCategory> locationsVisited,
    FeatureValue<LocationCategory> firstAdmissionLocation,
    FeatureValue<Double> hospitalLengthOfStayDays,
    FeatureValue<Double> firstIcuLengthOfStayDays
) {

    public LocationFeatures {
        locationsVisited = Set.copyOf(locationsVisited);
    }

    public static LocationFeatures none() {
        return new LocationFeatures(FeatureValue.unknown(), Set.of(), FeatureValue.unknown(),
            FeatureValue.unknown(), FeatureValue.unknown());
    }

    public boolean everIn(LocationCategory category) {
        return locationsVisited.contains(category);
    }
}
