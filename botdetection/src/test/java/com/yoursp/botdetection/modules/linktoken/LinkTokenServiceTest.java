package com.yoursp.botdetection.modules.linktoken;

import com.yoursp.botdetection.modules.network.ClientNetwork;
import com.yoursp.botdetection.modules.network.IpLiteral;
import com.yoursp.botdetection.modules.network.NetworkResolver;
import com.yoursp.botdetection.modules.network.RealIpExtractor;
import com.yoursp.botdetection.service.store.KeyValueStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;

import java.net.InetAddress;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Branch tests for LinkTokenService, with every collaborator mocked.
 */
@ExtendWith(MockitoExtension.class)
class LinkTokenServiceTest {

    private static final ClientNetwork NETWORK = ClientNetwork.parse("203.0.113.0/24");
    private static final InetAddress CLIENT_IP = IpLiteral.parse("203.0.113.42").orElseThrow();

    @Mock
    private KeyValueStore store;
    @Mock
    private TokenService tokenService;
    @Mock
    private PingService pingService;
    @Mock
    private RealIpExtractor realIpExtractor;
    @Mock
    private NetworkResolver networkResolver;

    @InjectMocks
    private LinkTokenService linkTokenService;

    private MockHttpServletRequest request() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Accept-Language", "en-US");
        request.addHeader("User-Agent", "TestBot/1.0");
        return request;
    }

    @Test
    @DisplayName("Store unreachable → not suspicious, ping ledger never consulted")
    void storeUnreachableIsNotSuspicious() {
        when(store.isAvailable()).thenReturn(false);

        assertFalse(linkTokenService.isSuspicious(NETWORK, request(), false));
        verifyNoInteractions(pingService);
    }

    @Test
    @DisplayName("Store reachable + no ping → suspicious")
    void missingPingIsSuspicious() {
        when(store.isAvailable()).thenReturn(true);
        when(pingService.hasPing(NETWORK, "en-US", "TestBot/1.0", false)).thenReturn(false);
        when(pingService.pingKey(NETWORK, "en-US", "TestBot/1.0")).thenReturn("link_token:ping[x]");

        assertTrue(linkTokenService.isSuspicious(NETWORK, request(), false));
    }

    @Test
    @DisplayName("Store reachable + ping → not suspicious, renew flag passed through")
    void pingPresentIsNotSuspicious() {
        when(store.isAvailable()).thenReturn(true);
        when(pingService.hasPing(NETWORK, "en-US", "TestBot/1.0", true)).thenReturn(true);

        assertFalse(linkTokenService.isSuspicious(NETWORK, request(), true));
        verify(pingService).hasPing(NETWORK, "en-US", "TestBot/1.0", true);
    }

    @Test
    @DisplayName("ping with a valid token records the client's network")
    void pingRecordsWithValidToken() {
        MockHttpServletRequest request = request();
        when(store.isAvailable()).thenReturn(true);
        when(tokenService.tokenIsValid("abcdefghijklmnop")).thenReturn(true);
        when(realIpExtractor.extract(request)).thenReturn(Optional.of(CLIENT_IP));
        when(networkResolver.resolve(CLIENT_IP)).thenReturn(NETWORK);

        linkTokenService.ping(request, "abcdefghijklmnop");

        verify(pingService).recordPing(NETWORK, "en-US", "TestBot/1.0");
    }

    @Test
    @DisplayName("ping with an invalid token writes nothing")
    void pingIgnoresInvalidToken() {
        when(store.isAvailable()).thenReturn(true);
        when(tokenService.tokenIsValid("stale")).thenReturn(false);

        linkTokenService.ping(request(), "stale");

        verifyNoInteractions(pingService, realIpExtractor);
    }

    @Test
    @DisplayName("ping with an unreachable store never validates or writes")
    void pingNoopWhenStoreUnreachable() {
        when(store.isAvailable()).thenReturn(false);

        linkTokenService.ping(request(), "abcdefghijklmnop");

        verifyNoInteractions(tokenService, pingService);
    }

    @Test
    @DisplayName("ping without a usable client address writes nothing")
    void pingNoopWithoutClientAddress() {
        MockHttpServletRequest request = request();
        when(store.isAvailable()).thenReturn(true);
        when(tokenService.tokenIsValid(anyString())).thenReturn(true);
        when(realIpExtractor.extract(request)).thenReturn(Optional.empty());

        linkTokenService.ping(request, "abcdefghijklmnop");

        verifyNoInteractions(pingService, networkResolver);
    }
}
