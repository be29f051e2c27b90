package slidewriter.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import slidewriter.core.model.slides.PresentationResult;

/**
 * DTO for a created presentation.
 */
public record CreateSlidesResponse(
        @JsonProperty("presentation_id") String presentationId,
        @JsonProperty("presentation_url") String presentationUrl,
        String message) {

    static final String SUCCESS_MESSAGE = "Slides created successfully";

    public static CreateSlidesResponse from(PresentationResult result) {
        return new CreateSlidesResponse(result.presentationId(), result.presentationUrl(), SUCCESS_MESSAGE);
    }
}
