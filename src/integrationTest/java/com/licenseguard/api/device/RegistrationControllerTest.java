package com.licenseguard.api.device;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.licenseguard.api.abuse.entities.RiskEvent;
import com.licenseguard.api.abuse.entities.RiskEventRepository;
import com.licenseguard.api.abuse.entities.RiskEventType;
import com.licenseguard.api.device.entities.DeviceRepository;
import com.licenseguard.api.device.entities.DeviceUserRepository;
import com.licenseguard.api.device.payload.RegistrationParams;
import com.licenseguard.api.identity.entities.User;
import com.licenseguard.api.identity.entities.UserRepository;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.stream.Stream;

import static com.licenseguard.api.testing.LicenseTestUtils.randomDeviceHash;
import static com.licenseguard.api.testing.LicenseTestUtils.randomEmail;
import static com.licenseguard.api.testing.LicenseTestUtils.randomIpAddress;
import static com.licenseguard.api.testing.LicenseTestUtils.readBody;
import static com.licenseguard.api.testing.LicenseTestUtils.register;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class RegistrationControllerTest {

    private static final long TRIAL_MILLIS = 14L * 24 * 60 * 60 * 1000;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private DeviceRepository deviceRepository;

    @Autowired
    private DeviceUserRepository deviceUserRepository;

    @Autowired
    private RiskEventRepository riskEventRepository;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void register_withNewDevice() throws Exception {
        val email = randomEmail();
        val hash = randomDeviceHash();
        val result = register(mockMvc, objectMapper, email, hash, randomIpAddress());
        assertEquals(HttpStatus.OK.value(), result.getResponse().getStatus());

        val body = readBody(objectMapper, result);
        assertEquals("trial", body.get("licenseStatus").asText());
        assertEquals("TRIAL_ACTIVE", body.get("outcome").asText());
        assertEquals(14, body.get("daysLeft").asLong());
        assertEquals(TRIAL_MILLIS, body.get("trialExpiresAt").asLong() - body.get("trialStartedAt").asLong());
        assertEquals(2, body.get("features").get("maxCameras").asInt());
        assertFalse(body.get("leaseToken").asText().isBlank());

        val device = deviceRepository.findByDeviceHash(hash).orElseThrow();
        assertTrue(device.isTrialConsumed());
        assertTrue(deviceUserRepository.existsByUserIdAndDeviceId(findUser(email).getId(), device.getId()));
    }

    @Test
    void register_withMixedCaseEmail() throws Exception {
        val email = randomEmail();
        val hash = randomDeviceHash();
        register(mockMvc, objectMapper, email, hash, randomIpAddress());
        val result = register(mockMvc, objectMapper, email.toUpperCase(), hash, randomIpAddress());
        assertEquals(HttpStatus.OK.value(), result.getResponse().getStatus());
        assertEquals(1, deviceUserRepository.countByUserId(findUser(email).getId()));
    }

    @Test
    void register_withKnownDevice() throws Exception {
        val email = randomEmail();
        val hash = randomDeviceHash();
        val first = readBody(objectMapper, register(mockMvc, objectMapper, email, hash, randomIpAddress()));
        val second = readBody(objectMapper, register(mockMvc, objectMapper, email, hash, randomIpAddress()));
        assertEquals(first.get("trialStartedAt").asLong(), second.get("trialStartedAt").asLong());
        assertEquals(first.get("trialExpiresAt").asLong(), second.get("trialExpiresAt").asLong());
    }

    @Test
    void register_withDeviceOfAnotherUser() throws Exception {
        val hash = randomDeviceHash();
        val first = readBody(objectMapper, register(mockMvc, objectMapper, randomEmail(), hash, randomIpAddress()));

        val result = register(mockMvc, objectMapper, randomEmail(), hash, randomIpAddress());
        assertEquals(HttpStatus.OK.value(), result.getResponse().getStatus());

        // a device never gets a second trial, whoever registers it.
        val second = readBody(objectMapper, result);
        assertEquals(first.get("trialStartedAt").asLong(), second.get("trialStartedAt").asLong());
        assertEquals(2, deviceUserRepository.findUserIdsByDeviceId(deviceRepository.findByDeviceHash(hash).orElseThrow().getId()).size());
    }

    @ParameterizedTest
    @MethodSource("invalidParamsTestCases")
    void register_withInvalidParams(String email, String deviceHash) throws Exception {
        mockMvc.perform(
                post("/v1/auth/register")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsBytes(new RegistrationParams(email, deviceHash))))
            .andExpect(status().is(HttpStatus.BAD_REQUEST.value()));
    }

    static Stream<Arguments> invalidParamsTestCases() {
        return Stream.of(
            Arguments.of(null, randomDeviceHash()),
            Arguments.of("", randomDeviceHash()),
            Arguments.of("not-an-email", randomDeviceHash()),
            Arguments.of(randomEmail(), null),
            Arguments.of(randomEmail(), "too-short"));
    }

    @Test
    void register_withDeviceCapExceeded() throws Exception {
        val email = randomEmail();
        val ipAddress = randomIpAddress();
        register(mockMvc, objectMapper, email, randomDeviceHash(), ipAddress);
        val user = findUser(email);
        userRepository.updateMaxDevices(user.getId(), 3);

        for (int i = 0; i < 2; i++) {
            val result = register(mockMvc, objectMapper, email, randomDeviceHash(), ipAddress);
            assertEquals(HttpStatus.OK.value(), result.getResponse().getStatus());
        }

        val rejectedHash = randomDeviceHash();
        val result = register(mockMvc, objectMapper, email, rejectedHash, ipAddress);
        assertEquals(HttpStatus.CONFLICT.value(), result.getResponse().getStatus());

        val body = readBody(objectMapper, result);
        assertEquals("DEVICE_CAP_EXCEEDED", body.get("error").asText());
        assertFalse(body.get("retryable").asBoolean());
        assertEquals(3, body.get("details").get("current").asInt());
        assertEquals(3, body.get("details").get("max").asInt());
        assertEquals("user", body.get("details").get("type").asText());

        // the rejected registration is rolled back, but its risk event is kept.
        assertEquals(3, deviceUserRepository.countByUserId(user.getId()));
        assertTrue(deviceRepository.findByDeviceHash(rejectedHash).isEmpty());
        assertEquals(1, countRiskEvents(user.getId(), RiskEventType.DEVICE_CAP_EXCEEDED));
    }

    @Test
    void register_withKnownDeviceAtCap() throws Exception {
        val email = randomEmail();
        val hash = randomDeviceHash();
        register(mockMvc, objectMapper, email, hash, randomIpAddress());
        register(mockMvc, objectMapper, email, randomDeviceHash(), randomIpAddress());

        val result = register(mockMvc, objectMapper, email, hash, randomIpAddress());
        assertEquals(HttpStatus.OK.value(), result.getResponse().getStatus());
        assertEquals(0, countRiskEvents(findUser(email).getId(), RiskEventType.DEVICE_CAP_EXCEEDED));
    }

    @Test
    void register_withDeviceChurn() throws Exception {
        val email = randomEmail();
        register(mockMvc, objectMapper, email, randomDeviceHash(), randomIpAddress());
        val user = findUser(email);
        userRepository.updateMaxDevices(user.getId(), 10);

        for (int i = 0; i < 4; i++) {
            val result = register(mockMvc, objectMapper, email, randomDeviceHash(), randomIpAddress());
            assertEquals(HttpStatus.OK.value(), result.getResponse().getStatus());
        }

        assertEquals(1, countRiskEvents(user.getId(), RiskEventType.DEVICE_CHURN_DETECTED));
    }

    @Test
    void register_withRapidCreationFromOneAddress() throws Exception {
        val ipAddress = randomIpAddress();
        for (int i = 0; i < 4; i++) {
            val result = register(mockMvc, objectMapper, randomEmail(), randomDeviceHash(), ipAddress);
            assertEquals(HttpStatus.OK.value(), result.getResponse().getStatus());
        }

        val events = riskEventRepository.findAllByEventType(RiskEventType.RAPID_DEVICE_CREATION).stream()
            .filter(e -> ipAddress.equals(e.getIpAddress()))
            .toList();

        assertEquals(1, events.size());
        assertEquals(3, ((Number) events.get(0).getMetadata().get("deviceCount")).intValue());
    }

    @NonNull
    private User findUser(@NonNull String email) {
        return userRepository.findByEmail(User.normaliseEmail(email)).orElseThrow();
    }

    private long countRiskEvents(long userId, @NonNull RiskEventType type) {
        return riskEventRepository.findAllByUserId(userId).stream()
            .map(RiskEvent::getEventType)
            .filter(type::equals)
            .count();
    }
}
