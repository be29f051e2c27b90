package slidewriter.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO reporting whether the caller holds a live session.
 *
 * @param state     AUTHENTICATED or NO_SESSION
 * @param expiresAt session expiry, only when authenticated
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStatusResponse(String state, @JsonProperty("expires_at") Instant expiresAt) {}
