package me.golemcore.modbot.antispam.rules;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.modbot.domain.model.RuleConfig;
import me.golemcore.modbot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds rule beans to their {@code bot.antispam.rules.*} configuration once at
 * startup.
 *
 * <p>
 * Rules are evaluated in configuration order. Rule beans that are not
 * configured stay disabled. Every problem found in the configuration is
 * collected into {@link #getValidationErrors()} instead of failing fast, so
 * staff see the whole list at once.
 */
@Component
@Slf4j
public class RuleRegistry {

    private final Map<String, AntiSpamRule> rulesByName = new LinkedHashMap<>();
    private final Map<String, BotProperties.RuleProperties> ruleProperties;
    private final List<BoundRule> boundRules = new ArrayList<>();
    private final List<String> validationErrors = new ArrayList<>();
    private Duration maxInterval = Duration.ZERO;

    public RuleRegistry(List<AntiSpamRule> rules, BotProperties properties) {
        this(rules, properties.getAntispam().getRules());
    }

    RuleRegistry(List<AntiSpamRule> rules, Map<String, BotProperties.RuleProperties> ruleProperties) {
        for (AntiSpamRule rule : rules) {
            rulesByName.put(rule.getName(), rule);
        }
        this.ruleProperties = ruleProperties != null ? ruleProperties : Map.of();
    }

    public static RuleRegistry forTesting(List<AntiSpamRule> rules,
            Map<String, BotProperties.RuleProperties> ruleProperties) {
        RuleRegistry registry = new RuleRegistry(rules, ruleProperties);
        registry.init();
        return registry;
    }

    @PostConstruct
    void init() {
        boundRules.clear();
        validationErrors.clear();
        maxInterval = Duration.ZERO;

        for (Map.Entry<String, BotProperties.RuleProperties> entry : ruleProperties.entrySet()) {
            String name = entry.getKey();
            AntiSpamRule rule = rulesByName.get(name);
            if (rule == null) {
                validationErrors.add("Rule `" + name + "` does not exist");
                continue;
            }
            List<String> errors = validate(name, rule, entry.getValue());
            if (!errors.isEmpty()) {
                validationErrors.addAll(errors);
                continue;
            }
            BotProperties.RuleProperties props = entry.getValue();
            RuleConfig config = new RuleConfig(Duration.ofSeconds(props.getInterval()), props.getMax(),
                    props.getExtras());
            boundRules.add(new BoundRule(rule, config));
            if (config.interval().compareTo(maxInterval) > 0) {
                maxInterval = config.interval();
            }
        }

        log.info("[AntiSpam] Bound {} rules: {}", boundRules.size(),
                boundRules.stream().map(bound -> bound.rule().getName()).toList());
        if (!validationErrors.isEmpty()) {
            log.error("[AntiSpam] Invalid rule configuration: {}", validationErrors);
        }
    }

    private List<String> validate(String name, AntiSpamRule rule, BotProperties.RuleProperties props) {
        List<String> errors = new ArrayList<>();
        if (props == null) {
            errors.add("Rule `" + name + "` has no configuration");
            return errors;
        }
        if (props.getInterval() == null) {
            errors.add("Rule `" + name + "` is missing field `interval`");
        } else if (props.getInterval() <= 0) {
            errors.add("Rule `" + name + "` has non-positive `interval` " + props.getInterval());
        }
        if (props.getMax() == null) {
            errors.add("Rule `" + name + "` is missing field `max`");
        } else if (props.getMax() < 0) {
            errors.add("Rule `" + name + "` has negative `max` " + props.getMax());
        }
        for (String extra : rule.getRequiredExtras()) {
            Integer value = props.getExtras() != null ? props.getExtras().get(extra) : null;
            if (value == null) {
                errors.add("Rule `" + name + "` is missing field `" + extra + "`");
            } else if (value < 0) {
                errors.add("Rule `" + name + "` has negative `" + extra + "` " + value);
            }
        }
        return errors;
    }

    /**
     * Rules with their configuration, in evaluation order.
     */
    public List<BoundRule> getBoundRules() {
        return List.copyOf(boundRules);
    }

    public List<String> getValidationErrors() {
        return List.copyOf(validationErrors);
    }

    public boolean isValid() {
        return validationErrors.isEmpty();
    }

    /**
     * Largest interval of any bound rule; older messages are never needed.
     */
    public Duration getMaxInterval() {
        return maxInterval;
    }

    public record BoundRule(AntiSpamRule rule, RuleConfig config) {
    }
}
