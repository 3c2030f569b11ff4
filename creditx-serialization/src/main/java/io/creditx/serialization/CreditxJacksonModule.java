package io.creditx.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.creditx.core.config.WeightsConfig;
import io.creditx.core.rule.Rule;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the weights-document serializers in one place.
///
/// - `WeightsConfig`: `WeightsConfigJsonSerializer` / `WeightsConfigJsonDeserializer`
/// - `Rule`: `RuleSerializer` / `RuleDeserializer`, discriminator: `"type"`
///
/// Result types (`ScoreResult`, `PriceSuggestion`, `BatchResult`) are records and need no
/// registration.
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see WeightsConfigSerializer for the convenience factory API
public class CreditxJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3573930125601844107L;

    public CreditxJacksonModule() {
        super("CreditxJacksonModule");

        addSerializer(WeightsConfig.class, new WeightsConfigJsonSerializer());
        addDeserializer(WeightsConfig.class, new WeightsConfigJsonDeserializer());

        addSerializer(Rule.class, new RuleSerializer());
        addDeserializer(Rule.class, new RuleDeserializer());
    }
}
