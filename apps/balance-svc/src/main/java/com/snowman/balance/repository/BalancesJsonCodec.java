package com.snowman.balance.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.snowman.balance.exception.CorruptBalanceDataException;
import com.snowman.balance.model.CurrencyBalances;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the {@code balances} JSON document, e.g. {@code {"gems":3,"gold":120}}.
 */
@Component
public class BalancesJsonCodec {

    private final ObjectReader reader;
    private final ObjectWriter writer;

    public BalancesJsonCodec(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.writer = objectMapper.writer().with(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    public CurrencyBalances read(long userId, String json) {
        if (json == null || json.isBlank()) {
            throw new CorruptBalanceDataException(userId, null, "empty document");
        }
        JsonNode root;
        try {
            root = reader.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new CorruptBalanceDataException(userId, null, "not valid JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptBalanceDataException(userId, null, "expected a JSON object");
        }
        Map<String, BigDecimal> amounts = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isNumber()) {
                throw new CorruptBalanceDataException(userId, field.getKey(),
                        "amount of '" + field.getKey() + "' is not numeric: " + value);
            }
            BigDecimal amount = value.decimalValue();
            if (!CurrencyBalances.inRange(amount)) {
                throw new CorruptBalanceDataException(userId, field.getKey(),
                        "amount of '" + field.getKey() + "' exceeds the supported digits");
            }
            amounts.put(field.getKey(), amount);
        }
        return CurrencyBalances.of(amounts);
    }

    public String write(CurrencyBalances balances) {
        try {
            return writer.writeValueAsString(balances.asMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize balances", ex);
        }
    }
}
