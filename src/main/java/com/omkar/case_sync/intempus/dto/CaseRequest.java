package com.omkar.case_sync.intempus.dto;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Writable case fields accepted by Intempus on create and update.
 * Null fields are left out of the outgoing JSON so an update only touches
 * what the caller sent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CaseRequest {
    private String responsible;
    private String coResponsible;
    private String caseState;
    private String customer;
    private String caseGroup;
    private String department;
    private String parent;
    private String priority;

    private String customerCountry;
    private String customerCity;
    private String customerStreetAddress;
    private String customerZipCode;
    private Double customerLatitude;
    private Double customerLongitude;
    private String customerName;
    private String customerId;

    private String departmentName;
    private String departmentId;
    private String responsibleName;
    private String responsibleId;
    private String coResponsibleName;
    private String coResponsibleId;
    private String caseStateName;
    private String caseStateId;

    private String parentName;
    private String rootParent;

    private LocalDate startDate;
    private LocalDate endDate;

    private String number;
    private String name;
    private String notes;
    private Double hourBudget;

    private String streetAddress;
    private String zipCode;
    private String city;
    private String country;
    private Double latitude;
    private Double longitude;

    private Boolean remarksRequired;
    private Boolean fileUploadRequired;
    private Boolean active;
    private Boolean permitNewWorkreports;
    private Boolean allEmployeesMayAddWorkReports;
    private Boolean allWorktypesMayUsedInWorkReports;
    private Boolean geofence;
    private String creationId;

    @JsonIgnore
    @Builder.Default
    private List<String> unknownFields = new ArrayList<>();

    @JsonAnySetter
    public void rejectUnknown(String field, Object value) {
        unknownFields.add(field);
    }

    public List<String> validateForCreate() {
        List<String> messages = validateForUpdate();
        if (isBlank(customer)) messages.add("customer is required");
        if (isBlank(number)) messages.add("number is required");
        if (isBlank(name)) messages.add("name is required");
        return messages;
    }

    public List<String> validateForUpdate() {
        List<String> messages = new ArrayList<>();
        for (String field : unknownFields) {
            messages.add("Unknown field: " + field);
        }
        return messages;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
