package com.chartboost.mediation.dtexchange.version;

import com.chartboost.mediation.dtexchange.VertxTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class VersionInfoTest extends VertxTest {

    @Test
    public void shouldCreateVersionWithUndefinedIfFileWasNotFound() {
        // when
        final VersionInfo versionInfo = VersionInfo.create("not_found.json", jacksonMapper);

        // then
        assertThat(versionInfo.getAdapterVersion()).isEqualTo("undefined");
    }

    @Test
    public void shouldCreateVersionInfoStrippingBuildQualifier() {
        // when
        final VersionInfo versionInfo = VersionInfo.create(
                "com/chartboost/mediation/dtexchange/version/version.json", jacksonMapper);

        // then
        assertThat(versionInfo.getAdapterVersion()).isEqualTo("5.8.3.0.0");
    }

    @Test
    public void shouldCreateVersionWithUndefinedIfPropertyIsMissing() {
        // when
        final VersionInfo versionInfo = VersionInfo.create(
                "com/chartboost/mediation/dtexchange/version/empty.json", jacksonMapper);

        // then
        assertThat(versionInfo.getAdapterVersion()).isEqualTo("undefined");
    }

    @Test
    public void shouldCreateVersionWithUndefinedIfFileIsMalformed() {
        // when
        final VersionInfo versionInfo = VersionInfo.create(
                "com/chartboost/mediation/dtexchange/version/malformed.json", jacksonMapper);

        // then
        assertThat(versionInfo.getAdapterVersion()).isEqualTo("undefined");
    }
}
