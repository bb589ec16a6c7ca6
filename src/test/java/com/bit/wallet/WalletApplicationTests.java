package com.bit.wallet;

import com.bit.wallet.database.DataBase;
import com.bit.wallet.database.memory.MemoryDb;
import com.bit.wallet.exception.ErrorType;
import com.bit.wallet.service.WalletService;
import com.bit.wallet.signer.SigningDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class WalletApplicationTests {

    @Autowired
    private DataBase dataBase;

    @Autowired
    private WalletService walletService;

    @Autowired
    private SigningDispatcher signingDispatcher;

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void contextUsesMemoryStorage() {
        assertInstanceOf(MemoryDb.class, dataBase);
        assertNotNull(signingDispatcher);
        assertFalse(walletService.isUnlocked());
    }

    @Test
    void signWhileLockedReturnsErrorEnvelope() {
        walletService.lock();
        Map<String, Object> body = Map.of("chain", "ETH", "params", Map.of("nonce", 0, "gasPrice", 1));
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange("/wallet/sign", HttpMethod.POST,
                new HttpEntity<>(body), new ParameterizedTypeReference<>() {
                });
        log.info("返回: {}", response.getBody());
        assertNotNull(response.getBody());
        assertEquals(false, response.getBody().get("success"));
        assertEquals(ErrorType.WALLET_LOCKED.getCode(), response.getBody().get("code"));
    }

    @Test
    void sessionEndpointReportsLocked() {
        walletService.lock();
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange("/wallet/session", HttpMethod.GET,
                null, new ParameterizedTypeReference<>() {
                });
        assertNotNull(response.getBody());
        assertEquals(true, response.getBody().get("success"));
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) response.getBody().get("data");
        assertEquals(false, data.get("unlocked"));
    }
}
