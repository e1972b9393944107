package com.snowman.balance.health;

import com.snowman.balance.config.BalanceProperties;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness only; does not touch the database. Reports how history timestamps are stored
 * so operators can match the deployed schema variant.
 */
@RestController
public class HealthzController {

    private final BalanceProperties properties;

    public HealthzController(BalanceProperties properties) {
        this.properties = properties;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of(
                "status", "UP",
                "timestampFormat", properties.store().timestampFormat().name());
    }
}
