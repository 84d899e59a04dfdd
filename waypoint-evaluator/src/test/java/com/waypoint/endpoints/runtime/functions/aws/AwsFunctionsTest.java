package com.waypoint.endpoints.runtime.functions.aws;

import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AwsFunctionsTest {

    private DiagnosticsCollector diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsCollector();
    }

    private Optional<Value> parseArn(String arn) {
        return AwsFunctions.parseArn(new Value[]{Value.of(arn)}, diagnostics);
    }

    @Test
    @DisplayName("Should parse an ARN and split its resource")
    void shouldParseArn() {
        Arn arn = (Arn) parseArn("arn:aws:s3:us-west-2:123456789012:accesspoint/my-ap:object").orElseThrow();

        assertThat(arn.partition()).isEqualTo("aws");
        assertThat(arn.service()).isEqualTo("s3");
        assertThat(arn.region()).isEqualTo("us-west-2");
        assertThat(arn.accountId()).isEqualTo("123456789012");
        assertThat(arn.resourceId()).containsExactly("accesspoint", "my-ap", "object");
        assertThat(arn.attribute("resourceId")).isEqualTo(Value.ofStrings(List.of("accesspoint", "my-ap", "object")));
    }

    @Test
    @DisplayName("Should allow empty region and account")
    void shouldAllowEmptyRegionAndAccount() {
        Arn arn = (Arn) parseArn("arn:aws:iam:::role/admin").orElseThrow();

        assertThat(arn.region()).isEmpty();
        assertThat(arn.accountId()).isEmpty();
        assertThat(arn.resourceId()).containsExactly("role", "admin");
    }

    @Test
    @DisplayName("Should yield absent and explain malformed ARNs")
    void shouldRejectMalformedArns() {
        assertThat(parseArn("not-an-arn")).isEmpty();
        assertThat(parseArn("arm:aws:s3:::bucket")).isEmpty();
        assertThat(parseArn("arn::s3:::bucket")).isEmpty();
        assertThat(parseArn("arn:aws::::bucket")).isEmpty();
        assertThat(parseArn("arn:aws:s3:::")).isEmpty();

        assertThat(diagnostics.getErrors()).hasSize(5);
        assertThat(diagnostics.getErrors().get(0)).contains("6 segments");
    }

    @ParameterizedTest(name = "{0} (subdomains={1}) -> {2}")
    @CsvSource({
            "my-bucket, false, true",
            "my.bucket, false, false",
            "my.bucket, true, true",
            "MyBucket, false, false",
            "ab, false, false",
            "192.168.0.1, true, false",
            "my.-bucket, true, false",
            "-bucket, false, false"
    })
    @DisplayName("Should decide whether a bucket name can be used as a host")
    void shouldValidateVirtualHostableBuckets(String bucket, boolean allowSubDomains, boolean expected) {
        assertThat(AwsFunctions.isVirtualHostableS3Bucket(bucket, allowSubDomains, diagnostics)).isEqualTo(expected);
    }
}
