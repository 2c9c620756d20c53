package com.ndclient.endpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ndclient.dto.request.SwitchCredentialsPayload;
import com.ndclient.dto.request.UserSwitchCredentialsPayload;
import com.ndclient.exception.RequestValidationException;
import com.ndclient.model.RequestDescriptor;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManageEndpointsTest {

    private static ValidatorFactory validatorFactory;
    private static ManageEndpoints endpoints;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeAll
    static void setUpAll() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        endpoints = new ManageEndpoints(validatorFactory.getValidator());
    }

    @AfterAll
    static void tearDownAll() {
        validatorFactory.close();
    }

    @Test
    void credentialEndpoints_shouldUseControllerPaths() {
        assertDescriptor(endpoints.credentialsDetailsGet(), HttpMethod.GET, "/api/v1/manage/credentials/details");
        assertDescriptor(endpoints.defaultSwitchCredentialsGet(), HttpMethod.GET,
                "/api/v1/manage/credentials/defaultSwitchCredentials");
        assertDescriptor(endpoints.defaultSwitchCredentialsDelete(), HttpMethod.DELETE,
                "/api/v1/manage/credentials/defaultSwitchCredentials");
        assertDescriptor(endpoints.robotSwitchCredentialsGet(), HttpMethod.GET,
                "/api/v1/manage/credentials/robotSwitchCredentials");
        assertDescriptor(endpoints.robotSwitchCredentialsDelete(), HttpMethod.DELETE,
                "/api/v1/manage/credentials/robotSwitchCredentials");
        assertDescriptor(endpoints.userSwitchCredentialsGet(), HttpMethod.GET, "/api/v1/manage/credentials/switches");
    }

    @Test
    void defaultSwitchCredentialsSave_shouldTrimCredentials() {
        RequestDescriptor descriptor = endpoints.defaultSwitchCredentialsSave("  admin ", " pw ");

        assertThat(descriptor.verb()).isEqualTo(HttpMethod.POST);
        assertThat(descriptor.body()).isEqualTo(SwitchCredentialsPayload.defaultCredentials("admin", "pw"));
        JsonNode body = objectMapper.valueToTree(descriptor.body());
        assertThat(body.get("switchUsername").asText()).isEqualTo("admin");
        assertThat(body.has("isRobot")).isFalse();
    }

    @Test
    void defaultSwitchCredentialsSave_shouldRejectBlankCredentials() {
        assertThatThrownBy(() -> endpoints.defaultSwitchCredentialsSave("admin", "   "))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("switchPassword");
        assertThatThrownBy(() -> endpoints.defaultSwitchCredentialsSave(null, "pw"))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("switchUsername");
    }

    @Test
    void robotSwitchCredentialsSave_shouldMarkBodyAsRobot() {
        RequestDescriptor descriptor = endpoints.robotSwitchCredentialsSave("robot", "pw");

        assertThat(descriptor.path()).isEqualTo("/api/v1/manage/credentials/robotSwitchCredentials");
        JsonNode body = objectMapper.valueToTree(descriptor.body());
        assertThat(body.get("isRobot").asBoolean()).isTrue();
        assertThat(body.get("switchPassword").asText()).isEqualTo("pw");
    }

    @Test
    void userSwitchCredentialsSave_shouldWrapSwitchIds() {
        RequestDescriptor descriptor = endpoints.userSwitchCredentialsSave(
                List.of("SAL1948TRTT", "SAL1947TRAB"), "admin", "pw");

        assertThat(descriptor.verb()).isEqualTo(HttpMethod.POST);
        assertThat(descriptor.path()).isEqualTo("/api/v1/manage/credentials/switches");
        assertThat(descriptor.body()).isInstanceOf(UserSwitchCredentialsPayload.class);
        JsonNode body = objectMapper.valueToTree(descriptor.body());
        assertThat(body.get("switchIds").get(0).get("switchId").asText()).isEqualTo("SAL1948TRTT");
        assertThat(body.get("switchIds").get(1).get("switchId").asText()).isEqualTo("SAL1947TRAB");
        assertThat(body.get("switchUsername").asText()).isEqualTo("admin");
    }

    @Test
    void userSwitchCredentialsSave_shouldRejectEmptyOrBlankSwitchIds() {
        assertThatThrownBy(() -> endpoints.userSwitchCredentialsSave(List.of(), "admin", "pw"))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("switchIds");
        assertThatThrownBy(() -> endpoints.userSwitchCredentialsSave(Arrays.asList("SAL1", " "), "admin", "pw"))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("switchId");
    }

    @Test
    void userSwitchCredentialsRemove_shouldPostToRemoveAction() {
        RequestDescriptor descriptor = endpoints.userSwitchCredentialsRemove(List.of("SAL1948TRTT"));

        assertThat(descriptor.verb()).isEqualTo(HttpMethod.POST);
        assertThat(descriptor.path()).isEqualTo("/api/v1/manage/credentials/switches/actions/remove");
        JsonNode body = objectMapper.valueToTree(descriptor.body());
        assertThat(body.get("switchIds").get(0).get("switchId").asText()).isEqualTo("SAL1948TRTT");

        assertThatThrownBy(() -> endpoints.userSwitchCredentialsRemove(null))
                .isInstanceOf(RequestValidationException.class);
    }

    @Test
    void fabricsGet_shouldOmitQueryWhenNoFilterIsSet() {
        assertDescriptor(endpoints.fabricsGet(null), HttpMethod.GET, "/api/v1/manage/fabrics");
        assertDescriptor(endpoints.fabricsGet(QueryFilter.builder().limit(0).build()), HttpMethod.GET,
                "/api/v1/manage/fabrics");
    }

    @Test
    void fabricDetailGet_shouldPutCategoryFirstAndEncodeFilter() {
        assertThat(endpoints.fabricDetailGet(QueryFilter.none()).path())
                .isEqualTo("/api/v1/manage/fabrics?category=fabric");

        RequestDescriptor descriptor = endpoints.fabricDetailGet(QueryFilter.builder()
                .filter("name:my_fabric")
                .max(10)
                .offset(5)
                .sort("name")
                .build());

        assertThat(descriptor.path())
                .isEqualTo("/api/v1/manage/fabrics?category=fabric&filter=name%3Amy_fabric&max=10&offset=5&sort=name");
    }

    @Test
    void fabricDetailGet_shouldRejectNegativePaging() {
        assertThatThrownBy(() -> endpoints.fabricDetailGet(QueryFilter.builder().offset(-1).build()))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("offset");
    }

    @Test
    void switchesInventoryGet_shouldEncodeFabricName() {
        assertDescriptor(endpoints.switchesInventoryGet("my fabric"), HttpMethod.GET,
                "/api/v1/manage/switches?fabricName=my%20fabric");
    }

    @Test
    void switchesInventoryGet_shouldRejectInvalidFabricName() {
        assertThatThrownBy(() -> endpoints.switchesInventoryGet(" "))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("fabricName");
        assertThatThrownBy(() -> endpoints.switchesInventoryGet("f".repeat(65)))
                .isInstanceOf(RequestValidationException.class);
        assertThat(endpoints.switchesInventoryGet("f".repeat(64)).path()).endsWith("f".repeat(64));
    }

    private static void assertDescriptor(RequestDescriptor descriptor, HttpMethod verb, String path) {
        assertThat(descriptor.verb()).isEqualTo(verb);
        assertThat(descriptor.path()).isEqualTo(path);
        assertThat(descriptor.hasBody()).isFalse();
    }
}
