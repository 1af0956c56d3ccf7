package com.licenseguard.api.device;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.licenseguard.api.abuse.entities.RiskEventRepository;
import com.licenseguard.api.abuse.entities.RiskEventType;
import com.licenseguard.api.identity.entities.User;
import com.licenseguard.api.identity.entities.UserRepository;
import lombok.val;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static com.licenseguard.api.testing.LicenseTestUtils.randomDeviceHash;
import static com.licenseguard.api.testing.LicenseTestUtils.randomEmail;
import static com.licenseguard.api.testing.LicenseTestUtils.randomIpAddress;
import static com.licenseguard.api.testing.LicenseTestUtils.readBody;
import static com.licenseguard.api.testing.LicenseTestUtils.register;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestPropertySource(properties = {
    "app.abuse.max-devices-per-ip-per-window=2",
    "app.abuse.max-devices-per-user-per-window=2",
    "app.abuse.default-max-devices-per-user=10",
})
public class RegistrationRateLimitTest {

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private RiskEventRepository riskEventRepository;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void register_withIpAddressLimitExceeded() throws Exception {
        val ipAddress = randomIpAddress();
        for (int i = 0; i < 2; i++) {
            val result = register(mockMvc, objectMapper, randomEmail(), randomDeviceHash(), ipAddress);
            assertEquals(HttpStatus.OK.value(), result.getResponse().getStatus());
        }

        val result = register(mockMvc, objectMapper, randomEmail(), randomDeviceHash(), ipAddress);
        assertEquals(HttpStatus.TOO_MANY_REQUESTS.value(), result.getResponse().getStatus());

        val retryAfter = result.getResponse().getHeader(RegistrationController.RETRY_AFTER_HEADER);
        assertNotNull(retryAfter);
        assertTrue(Long.parseLong(retryAfter) >= 1);
        assertTrue(Long.parseLong(retryAfter) <= 24 * 60 * 60);

        val body = readBody(objectMapper, result);
        assertEquals("RATE_LIMIT_EXCEEDED", body.get("error").asText());
        assertTrue(body.get("retryable").asBoolean());
        assertEquals(3, body.get("details").get("current").asInt());
        assertEquals(2, body.get("details").get("max").asInt());
        assertEquals("ip", body.get("details").get("type").asText());

        val events = riskEventRepository.findAllByEventType(RiskEventType.DEVICE_CREATION_RATE_LIMIT).stream()
            .filter(e -> ipAddress.equals(e.getIpAddress()))
            .count();

        assertEquals(1, events);
    }

    @Test
    void register_withUserLimitExceeded() throws Exception {
        val email = randomEmail();
        for (int i = 0; i < 2; i++) {
            val result = register(mockMvc, objectMapper, email, randomDeviceHash(), randomIpAddress());
            assertEquals(HttpStatus.OK.value(), result.getResponse().getStatus());
        }

        val result = register(mockMvc, objectMapper, email, randomDeviceHash(), randomIpAddress());
        assertEquals(HttpStatus.TOO_MANY_REQUESTS.value(), result.getResponse().getStatus());
        assertEquals("user", readBody(objectMapper, result).get("details").get("type").asText());

        val userId = userRepository.findByEmail(User.normaliseEmail(email)).orElseThrow().getId();
        val events = riskEventRepository.findAllByUserId(userId).stream()
            .filter(e -> e.getEventType() == RiskEventType.DEVICE_CREATION_RATE_LIMIT)
            .count();

        assertEquals(1, events);
    }

    @Test
    void register_withKnownDeviceAfterLimitExceeded() throws Exception {
        val email = randomEmail();
        val hash = randomDeviceHash();
        register(mockMvc, objectMapper, email, hash, randomIpAddress());
        register(mockMvc, objectMapper, email, randomDeviceHash(), randomIpAddress());

        // re-registering a linked device creates nothing, so it isn't rate limited.
        val result = register(mockMvc, objectMapper, email, hash, randomIpAddress());
        assertEquals(HttpStatus.OK.value(), result.getResponse().getStatus());
    }
}
