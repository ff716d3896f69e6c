package com.vth.adapter.out.persistence;

import com.vth.domain.model.Currency;
import com.vth.domain.model.RateEntry;
import com.vth.domain.model.RateProvider;
import com.vth.domain.model.RateTable;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON layout of a stored rate table. Prices are written as strings to keep their exact scale.
 */
final class RateTableJsonCodec {

    private RateTableJsonCodec() {
    }

    static JsonObject encode(RateTable table) {
        JsonObject rates = new JsonObject();
        table.getEntries().values().stream()
                .filter(entry -> !entry.isBase())
                .forEach(entry -> rates.put(entry.getCurrency().getCode(), new JsonObject()
                        .put("price_in_base", entry.getPriceInBase().toPlainString())
                        .put("fetched_at", entry.getFetchedAt().toString())
                        .put("source", entry.getSource().getValue())));

        return new JsonObject()
                .put("version", table.getVersion())
                .put("base_currency", table.getBaseCurrency().getCode())
                .put("as_of", table.getAsOf().toString())
                .put("created_at", table.getCreatedAt().toString())
                .put("rates", rates);
    }

    static RateTable decode(JsonObject json) {
        Currency base = Currency.fromValue(json.getString("base_currency"));
        JsonObject rates = json.getJsonObject("rates", new JsonObject());

        List<RateEntry> entries = new ArrayList<>();
        for (String code : rates.fieldNames()) {
            JsonObject rate = rates.getJsonObject(code);
            entries.add(new RateEntry(
                    Currency.fromValue(code),
                    new BigDecimal(rate.getString("price_in_base")),
                    Instant.parse(rate.getString("fetched_at")),
                    RateProvider.fromValue(rate.getString("source"))
            ));
        }

        return RateTable.of(
                json.getLong("version"),
                base,
                entries,
                Instant.parse(json.getString("created_at"))
        );
    }
}
