package com.greencover.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.greencover.model.base.BaseEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Cached calculation result. The id is the derived cache key; the payload is
 * serialized text the store never interprets.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheEntry extends BaseEntity<String> {

    private CalculationType calculationType;

    /**
     * Null for calculations not bound to a registered city, e.g. ad-hoc boundary files
     */
    private Long cityId;

    private String cityName;

    private String payload;

    public String getKey() {
        return getId();
    }

    public boolean belongsTo(String city) {
        return cityName != null && city != null && cityName.equalsIgnoreCase(city.trim());
    }
}
