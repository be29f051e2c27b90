package slidewriter.adapter.in.problem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * RFC 7807 problem body. Extension members are written at the top level next to
 * the standard ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"title", "status", "detail"})
public final class ProblemDetail {

    private final String title;
    private final int status;
    private final String detail;
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    ProblemDetail(String title, int status, String detail) {
        this.title = title;
        this.status = status;
        this.detail = detail;
    }

    ProblemDetail with(String name, Object value) {
        parameters.put(name, value);
        return this;
    }

    public String getTitle() {
        return title;
    }

    public int getStatus() {
        return status;
    }

    public String getDetail() {
        return detail;
    }

    @JsonAnyGetter
    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }
}
