package com.chartboost.mediation.dtexchange.version;

import com.chartboost.mediation.dtexchange.json.DecodeException;
import com.chartboost.mediation.dtexchange.json.JacksonMapper;
import com.chartboost.mediation.dtexchange.log.Logger;
import com.chartboost.mediation.dtexchange.log.LoggerFactory;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Value;

import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adapter version read from the version file bundled at build time.
 */
@Value
public class VersionInfo {

    private static final Logger logger = LoggerFactory.getLogger(VersionInfo.class);

    private static final String UNDEFINED = "undefined";
    private static final Pattern VERSION_PATTERN = Pattern.compile("\\d+(\\.\\d+){2,4}");

    String adapterVersion;

    private VersionInfo(String adapterVersion) {
        this.adapterVersion = adapterVersion;
    }

    public static VersionInfo create(String versionFilePath, JacksonMapper jacksonMapper) {
        final Revision revision;
        try (InputStream inputStream = VersionInfo.class.getClassLoader().getResourceAsStream(versionFilePath)) {
            if (inputStream == null) {
                logger.error("Was not able to find version file {0}", versionFilePath);
                return new VersionInfo(UNDEFINED);
            }
            revision = jacksonMapper.decodeValue(inputStream, Revision.class);
        } catch (DecodeException | IOException e) {
            logger.error("Was not able to read version file {0}. Reason: {1}", versionFilePath, e.getMessage());
            return new VersionInfo(UNDEFINED);
        }

        final String version = revision.getAdapterVersion() != null
                ? extractVersion(revision.getAdapterVersion())
                : null;
        return new VersionInfo(version != null ? version : UNDEFINED);
    }

    private static String extractVersion(String buildVersion) {
        final Matcher versionMatcher = VERSION_PATTERN.matcher(buildVersion);

        return versionMatcher.lookingAt() ? versionMatcher.group() : null;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    @Data
    private static class Revision {

        @JsonProperty("adapter.version")
        String adapterVersion;
    }
}
