package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.config.ControlPlaneProperties;
import com.vibecoding.ocloud.exception.SmoClientException;
import com.vibecoding.ocloud.model.ocloud.OCloud;
import com.vibecoding.ocloud.model.ocloud.OCloudSpec;
import com.vibecoding.ocloud.model.ocloud.SmoConfig;
import com.vibecoding.ocloud.model.smo.Alarm;
import com.vibecoding.ocloud.model.smo.Policy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * SMO REST 클라이언트 테스트
 */
class SmoClientTest {

    private static final String ENDPOINT = "http://smo.test";

    private MockRestServiceServer mockServer;
    private SmoClient smoClient;
    private ControlPlaneProperties properties;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new ControlPlaneProperties();
        smoClient = new SmoClient(restTemplate, properties);
    }

    @Test
    @DisplayName("health check 200 이면 연결됨")
    void testConnect() {
        mockServer.expect(requestTo(ENDPOINT + "/api/v1/health"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        SmoConfig config = config(null);
        smoClient.connect(config);

        assertTrue(smoClient.isConnected(config));
        mockServer.verify();
    }

    @Test
    @DisplayName("health check 503 이면 상태 코드를 담은 SmoClientException")
    void testConnectUnavailable() {
        mockServer.expect(requestTo(ENDPOINT + "/api/v1/health"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        SmoConfig config = config(null);
        SmoClientException e = assertThrows(SmoClientException.class, () -> smoClient.connect(config));

        assertEquals(503, e.getStatusCode());
        assertTrue(e.getMessage().contains("returned status 503"));
        assertFalse(smoClient.isConnected(config));
    }

    @Test
    @DisplayName("health check 가 200 이 아닌 2xx 면 실패")
    void testConnectNonOkSuccess() {
        mockServer.expect(requestTo(ENDPOINT + "/api/v1/health"))
            .andRespond(withStatus(HttpStatus.NO_CONTENT));

        SmoClientException e = assertThrows(SmoClientException.class, () -> smoClient.connect(config(null)));
        assertEquals(204, e.getStatusCode());
    }

    @Test
    @DisplayName("O-Cloud 등록은 201 허용, authType 이 있으면 Bearer 토큰 전송")
    void testRegisterWithBearerToken() {
        properties.getSmo().setToken("secret-token");
        mockServer.expect(requestTo(ENDPOINT + "/api/v1/oclouds"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer secret-token"))
            .andExpect(jsonPath("$.id").value("oc-edge"))
            .andRespond(withStatus(HttpStatus.CREATED));

        OCloud ocloud = OCloud.builder()
            .name("oc-edge")
            .spec(OCloudSpec.builder().smo(config("bearer")).build())
            .build();
        smoClient.registerOCloud(ocloud);

        mockServer.verify();
    }

    @Test
    @DisplayName("정책 목록 조회")
    void testGetPolicies() {
        mockServer.expect(requestTo(ENDPOINT + "/api/v1/oclouds/oc-edge/policies"))
            .andRespond(withSuccess("[{\"id\":\"p1\",\"name\":\"scale-out\",\"type\":\"scaling\",\"priority\":3}]",
                MediaType.APPLICATION_JSON));

        List<Policy> policies = smoClient.getPolicies(config(null), "oc-edge");

        assertEquals(1, policies.size());
        assertEquals("scale-out", policies.get(0).getName());
        assertEquals(3, policies.get(0).getPriority());
    }

    @Test
    @DisplayName("알람 전송 실패 시 상태 코드 전달")
    void testSendAlarmFailure() {
        mockServer.expect(requestTo(ENDPOINT + "/api/v1/alarms"))
            .andExpect(method(HttpMethod.POST))
            .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        Alarm alarm = Alarm.builder().id("alarm-1").type("resource").severity("warning").build();
        SmoClientException e = assertThrows(SmoClientException.class,
            () -> smoClient.sendAlarm(config(null), alarm));

        assertEquals(500, e.getStatusCode());
        assertEquals("alarm send returned status 500", e.getMessage());
    }

    @Test
    @DisplayName("endpoint 가 없으면 요청 없이 실패")
    void testMissingEndpoint() {
        SmoConfig config = SmoConfig.builder().enabled(true).build();

        assertThrows(SmoClientException.class, () -> smoClient.connect(config));
        mockServer.verify();
    }

    private static SmoConfig config(String authType) {
        return SmoConfig.builder()
            .enabled(true)
            .endpoint(ENDPOINT)
            .authType(authType)
            .build();
    }
}
