package com.sendseven.passkeyauth.controller;

import static com.sendseven.passkeyauth.service.TestProperties.TOKEN_PATH;
import static com.sendseven.passkeyauth.service.TestProperties.USERINFO_PATH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sendseven.passkeyauth.service.CryptoNonceGenerator;
import com.sendseven.passkeyauth.service.StubExchangeFunction;
import com.sendseven.passkeyauth.session.SessionData;
import com.sendseven.passkeyauth.user.User;
import com.sendseven.passkeyauth.user.UserRepository;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AuthControllerIntegrationTest {

    private static final String SESSION_AUTH = "auth_session";

    @TestConfiguration
    static class StubProviderConfig {

        @Bean
        StubExchangeFunction stubProvider() {
            return new StubExchangeFunction();
        }

        @Bean
        @Primary
        WebClient stubProviderWebClient(StubExchangeFunction stubProvider) {
            return stubProvider.webClient();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private StubExchangeFunction provider;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private CryptoNonceGenerator nonceGenerator;

    @BeforeEach
    void setUp() {
        provider.reset();
    }

    @Test
    void fullLogin_initiateCallbackAndResolveUser() throws Exception {
        MockHttpSession session = new MockHttpSession();

        // Initiate
        MvcResult login = mockMvc.perform(get("/auth/login").session(session))
                .andExpect(status().is3xxRedirection())
                .andReturn();
        SessionData pending = sessionData(session);
        String state = pending.getStateValue();
        String verifier = pending.getCodeVerifier();

        String location = login.getResponse().getRedirectedUrl();
        assertThat(location).startsWith(
                "https://idp.example.com/v1/tenants/tenant-1/realms/realm-1/applications/app-1/authorize?");
        MultiValueMap<String, String> query = UriComponentsBuilder.fromUriString(location).build().getQueryParams();
        assertThat(query.getFirst("state")).isEqualTo(state);
        assertThat(query.getFirst("code_challenge")).isEqualTo(nonceGenerator.deriveChallenge(verifier));
        assertThat(provider.getRequests()).isEmpty();

        // Callback
        provider.respondJson(TOKEN_PATH, HttpStatus.OK, "{\"access_token\":\"T\",\"token_type\":\"Bearer\"}");
        provider.respondJson(USERINFO_PATH, HttpStatus.OK, "{\"sub\":\"sub-1\",\"preferred_username\":\"alice\"}");

        mockMvc.perform(get("/auth/callback").param("code", "ABC").param("state", state).session(session))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/"));

        ClientRequest tokenRequest = provider.requestsTo(TOKEN_PATH).get(0);
        assertThat(StubExchangeFunction.bodyOf(tokenRequest)).contains("code=ABC", "code_verifier=" + verifier);

        SessionData done = sessionData(session);
        assertThat(done.getUserId()).isNotNull();
        assertThat(done.getStateValue()).isNull();
        assertThat(done.getCodeVerifier()).isNull();

        // Current user
        mockMvc.perform(get("/api/user").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(done.getUserId()))
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.externalId").doesNotExist());
    }

    @Test
    void callback_wrongState_redirectsHomeWithoutNetworkCall() throws Exception {
        MockHttpSession session = new MockHttpSession();
        SessionData data = new SessionData();
        data.startHandshake("S1", "V1", Instant.now());
        session.setAttribute(SESSION_AUTH, data);

        mockMvc.perform(get("/auth/callback").param("code", "ABC").param("state", "WRONG").session(session))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/"));

        assertThat(provider.getRequests()).isEmpty();
        SessionData after = sessionData(session);
        assertThat(after.getStateValue()).isEqualTo("S1");
        assertThat(after.getCodeVerifier()).isEqualTo("V1");
        assertThat(after.getUserId()).isNull();
    }

    @Test
    void callback_missingParameters_redirectsHome() throws Exception {
        mockMvc.perform(get("/auth/callback").param("state", "S1"))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/"));

        assertThat(provider.getRequests()).isEmpty();
    }

    @Test
    void callback_providerRejectsCode_redirectsHomeWithoutLeakingError() throws Exception {
        MockHttpSession session = new MockHttpSession();
        SessionData data = new SessionData();
        data.startHandshake("S1", "V1", Instant.now());
        session.setAttribute(SESSION_AUTH, data);
        provider.respondJson(TOKEN_PATH, HttpStatus.BAD_REQUEST, "{\"error\":\"invalid_grant\"}");

        MvcResult result = mockMvc.perform(get("/auth/callback").param("code", "ABC").param("state", "S1").session(session))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/"))
                .andReturn();

        assertThat(result.getResponse().getContentAsString()).doesNotContain("invalid_grant");
        assertThat(sessionData(session).getUserId()).isNull();
    }

    @Test
    void apiUser_anonymous_redirectsToLogin() throws Exception {
        mockMvc.perform(get("/api/user"))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/login"));
    }

    @Test
    void apiUser_deletedUser_logsOutAndRedirectsToLogin() throws Exception {
        User user = userRepository.upsertByExternalId("sub-deleted", "ghost");
        MockHttpSession session = new MockHttpSession();
        SessionData data = new SessionData();
        data.authenticate(user.getId(), Instant.now());
        session.setAttribute(SESSION_AUTH, data);
        userRepository.deleteById(user.getId());

        mockMvc.perform(get("/api/user").session(session))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/login"));

        assertThat(session.isInvalid()).isTrue();
    }

    @Test
    void logout_invalidatesSessionAndRedirectsToLogin() throws Exception {
        MockHttpSession session = new MockHttpSession();
        SessionData data = new SessionData();
        data.authenticate("user-1", Instant.now());
        session.setAttribute(SESSION_AUTH, data);

        mockMvc.perform(get("/logout").session(session))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrl("/login"));

        assertThat(session.isInvalid()).isTrue();
    }

    private static SessionData sessionData(MockHttpSession session) {
        return (SessionData) session.getAttribute(SESSION_AUTH);
    }
}
