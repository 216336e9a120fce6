package com.omkar.case_sync.intempus;

import com.omkar.case_sync.config.IntempusConfig;
import com.omkar.case_sync.intempus.dto.CasePage;
import com.omkar.case_sync.intempus.dto.CaseRequest;
import com.omkar.case_sync.intempus.dto.CaseResponse;
import com.omkar.case_sync.shared.ErrorDetail;
import com.omkar.case_sync.shared.Result;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.function.Supplier;

/**
 * Client for the Intempus case endpoint.
 *
 * All calls are synchronous and bounded by the RestTemplate timeouts. Transport
 * and upstream-status failures are returned as {@link ErrorDetail} values,
 * never thrown.
 *
 * @see <a href="https://intempus.dk/web-doc/v1/#tag---Case">Intempus Case API</a>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntempusClient implements CasePageSource {
    private final RestTemplate intempusRestTemplate;
    private final IntempusConfig intempusConfig;

    @Override
    public Result<CasePage> fetchPage(int limit, int offset) {
        URI uri = UriComponentsBuilder.fromHttpUrl(intempusConfig.getCaseUri())
                .queryParam("limit", limit)
                .queryParam("offset", offset)
                .build()
                .toUri();
        return requireBody(() -> intempusRestTemplate.getForObject(uri, CasePage.class));
    }

    public PagedCaseStream streamCases(int limit) {
        return new PagedCaseStream(this, limit);
    }

    public Result<CaseResponse> createCase(CaseRequest request) {
        return requireBody(() -> intempusRestTemplate.postForObject(
                intempusConfig.getCaseUri(), request, CaseResponse.class));
    }

    public Result<CaseResponse> updateCase(long id, CaseRequest request) {
        return requireBody(() -> intempusRestTemplate.exchange(
                caseUri(id), HttpMethod.PUT, new HttpEntity<>(request), CaseResponse.class).getBody());
    }

    public Result<Void> deleteCase(long id) {
        try {
            intempusRestTemplate.delete(caseUri(id));
            return Result.success();
        } catch (RestClientException e) {
            return Result.failure(toErrorDetail(e));
        }
    }

    private String caseUri(long id) {
        return intempusConfig.getCaseUri() + id + "/";
    }

    private <T> Result<T> requireBody(Supplier<T> call) {
        try {
            T body = call.get();
            if (body == null) {
                log.error("Intempus returned an empty body");
                return Result.failure(ErrorDetail.unreadableResponse(
                        new IllegalStateException("Empty response body")));
            }
            return Result.success(body);
        } catch (RestClientException e) {
            return Result.failure(toErrorDetail(e));
        }
    }

    private ErrorDetail toErrorDetail(RestClientException e) {
        if (e instanceof RestClientResponseException) {
            RestClientResponseException response = (RestClientResponseException) e;
            int status = response.getStatusCode().value();
            String text = response.getResponseBodyAsString();
            log.error("HTTP error {}: {}", status, text);
            return ErrorDetail.upstreamStatus(status, text);
        }
        if (e instanceof ResourceAccessException) {
            log.error("Network error: {}", e.getMessage());
            return ErrorDetail.transport(e);
        }
        log.error("Unreadable response from Intempus", e);
        return ErrorDetail.unreadableResponse(e);
    }
}
