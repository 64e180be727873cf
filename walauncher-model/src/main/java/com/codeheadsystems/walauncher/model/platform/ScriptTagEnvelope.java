package com.codeheadsystems.walauncher.model.platform;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Single script tag wrapper used by the create call and its response.
 *
 * @param scriptTag the wrapped tag
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScriptTagEnvelope(@JsonProperty("script_tag") ScriptTag scriptTag) {
}
