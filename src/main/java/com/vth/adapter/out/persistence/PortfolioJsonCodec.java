package com.vth.adapter.out.persistence;

import com.vth.domain.model.Currency;
import com.vth.domain.model.Portfolio;
import com.vth.domain.model.TradeDirection;
import com.vth.domain.model.TradeReceipt;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * JSON layout of a stored portfolio snapshot
 */
final class PortfolioJsonCodec {

    private PortfolioJsonCodec() {
    }

    static JsonObject encode(Portfolio.Snapshot snapshot) {
        JsonObject wallets = new JsonObject();
        snapshot.balances().forEach((currency, balance) -> wallets.put(currency.getCode(), balance.toPlainString()));

        JsonArray trades = new JsonArray();
        snapshot.trades().forEach(receipt -> trades.add(encodeReceipt(receipt)));

        return new JsonObject()
                .put("user_id", snapshot.userId())
                .put("base_currency", snapshot.baseCurrency().getCode())
                .put("wallets", wallets)
                .put("trades", trades);
    }

    static Portfolio decode(JsonObject json) {
        Map<Currency, BigDecimal> balances = new EnumMap<>(Currency.class);
        JsonObject wallets = json.getJsonObject("wallets", new JsonObject());
        for (String code : wallets.fieldNames()) {
            balances.put(Currency.fromValue(code), new BigDecimal(wallets.getString(code)));
        }

        List<TradeReceipt> trades = new ArrayList<>();
        JsonArray stored = json.getJsonArray("trades", new JsonArray());
        for (int i = 0; i < stored.size(); i++) {
            trades.add(decodeReceipt(stored.getJsonObject(i)));
        }

        return new Portfolio(
                json.getString("user_id"),
                Currency.fromValue(json.getString("base_currency")),
                balances,
                trades
        );
    }

    private static JsonObject encodeReceipt(TradeReceipt receipt) {
        return new JsonObject()
                .put("id", receipt.getId())
                .put("user_id", receipt.getUserId())
                .put("currency", receipt.getCurrency().getCode())
                .put("direction", receipt.getDirection().getValue())
                .put("amount", receipt.getAmount().toPlainString())
                .put("rate_used", receipt.getRateUsed().toPlainString())
                .put("base_currency", receipt.getBaseCurrency().getCode())
                .put("base_currency_delta", receipt.getBaseCurrencyDelta().toPlainString())
                .put("rate_table_version", receipt.getRateTableVersion())
                .put("timestamp", receipt.getTimestamp().toString());
    }

    private static TradeReceipt decodeReceipt(JsonObject json) {
        return TradeReceipt.builder()
                .id(json.getString("id"))
                .userId(json.getString("user_id"))
                .currency(Currency.fromValue(json.getString("currency")))
                .direction(TradeDirection.fromValue(json.getString("direction")))
                .amount(new BigDecimal(json.getString("amount")))
                .rateUsed(new BigDecimal(json.getString("rate_used")))
                .baseCurrency(Currency.fromValue(json.getString("base_currency")))
                .baseCurrencyDelta(new BigDecimal(json.getString("base_currency_delta")))
                .rateTableVersion(json.getLong("rate_table_version", 0L))
                .timestamp(Instant.parse(json.getString("timestamp")))
                .build();
    }
}
