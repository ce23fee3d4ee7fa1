package de.bsommerfeld.catalogcrawler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single session cookie sent with every forum request. Logged-in cookies
 * unlock download links that are masked for anonymous visitors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CookieConfig {

    @JsonProperty("name")
    private String name;

    @JsonProperty("value")
    private String value;

    @JsonProperty("domain")
    private String domain = "f95zone.to";

    public CookieConfig() {
    }

    public CookieConfig(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public String getDomain() {
        return domain;
    }
}
