package net.spookly.tierline.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a {@code POST /call-event} webhook.
 *
 * <p>The ZIP may arrive as a JSON number; it is normalized by the ZIP index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CallEventRequest {
    @JsonProperty("caller_id")
    public String callerId;
    @JsonProperty("zip_code")
    public String zipCode;
}
