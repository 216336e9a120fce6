package com.omkar.case_sync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omkar.case_sync.intempus.dto.CaseResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CasePayloadMapper {
    private final ObjectMapper objectMapper;

    public CaseRecord toRecord(CaseResponse remote) {
        return new CaseRecord(remote.getId(), remote.version(), toPayload(remote));
    }

    public String toPayload(CaseResponse remote) {
        try {
            return objectMapper.writeValueAsString(remote);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Case " + remote.getId() + " cannot be serialized", e);
        }
    }
}
