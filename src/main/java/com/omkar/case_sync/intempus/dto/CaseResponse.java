package com.omkar.case_sync.intempus.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A case as returned by Intempus.
 * Only the id and the logical timestamp are interpreted; every other field is
 * kept as-is so the record can be written back out unchanged.
 */
@ToString
@EqualsAndHashCode
@NoArgsConstructor
public class CaseResponse {
    @Getter
    @Setter
    @JsonProperty("id")
    private long id;

    @Getter
    @Setter
    @JsonProperty("logical_timestamp")
    private Long logicalTimestamp;

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public CaseResponse(long id, Long logicalTimestamp) {
        this.id = id;
        this.logicalTimestamp = logicalTimestamp;
    }

    /**
     * Version used for staleness checks. Intempus omits the field on some
     * legacy cases; those count as version 0.
     */
    public long version() {
        return logicalTimestamp != null ? logicalTimestamp : 0L;
    }

    @JsonAnySetter
    public CaseResponse attribute(String name, Object value) {
        attributes.put(name, value);
        return this;
    }

    @JsonAnyGetter
    public Map<String, Object> attributes() {
        return attributes;
    }
}
