package de.htwsaar.assetpipe.assets.manifest;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * JSON-Form von {@code manifest.json}.
 *
 * @param files logischer Pfad → Eintrag
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManifestDocument(Map<String, Entry> files) {

    /**
     * Ein Eintrag im Manifest. {@code hashed} wird als Alias für {@code filename} akzeptiert.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(
            String path,
            @JsonAlias("hashed") String filename,
            String sri,
            long size,
            @JsonProperty("content_type") String contentType) {}
}
