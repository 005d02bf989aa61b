package org.carball.rightsizer.model.analysis;

public record RegionAlternative(String region, double monthlyPrice, double savings) {
}
