package com.memehub.engagement.service;

import com.memehub.engagement.badge.BadgeCriteriaParser;
import com.memehub.engagement.config.EngagementProperties;
import com.memehub.engagement.entity.Badge;
import com.memehub.engagement.repository.BadgeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Synchronises engagement.badges into the badge table at start-up: new keys
 * are inserted, changed definitions updated. Badges missing from the
 * configuration are left in place so existing awards keep their badge.
 *
 * Any criteria descriptor that does not parse stops the application.
 */
@Component
public class BadgeCatalogInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BadgeCatalogInitializer.class);

    private final EngagementProperties properties;
    private final BadgeRepository badgeRepository;
    private final BadgeCriteriaParser criteriaParser;

    public BadgeCatalogInitializer(EngagementProperties properties,
                                   BadgeRepository badgeRepository,
                                   BadgeCriteriaParser criteriaParser) {
        this.properties = properties;
        this.badgeRepository = badgeRepository;
        this.criteriaParser = criteriaParser;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        int inserted = 0;
        int updated = 0;
        Set<String> seen = new HashSet<>();
        for (EngagementProperties.BadgeDefinition definition : properties.getBadges()) {
            validate(definition, seen);

            Optional<Badge> existing = badgeRepository.findByBadgeKey(definition.getKey());
            if (existing.isEmpty()) {
                badgeRepository.save(new Badge(null, definition.getKey(), definition.getName(),
                        definition.getDescription(), definition.getCategory(), definition.getCriteria().trim()));
                inserted++;
                continue;
            }
            Badge badge = existing.get();
            if (!sameDefinition(badge, definition)) {
                badge.setName(definition.getName());
                badge.setDescription(definition.getDescription());
                badge.setCategory(definition.getCategory());
                badge.setCriteria(definition.getCriteria().trim());
                updated++;
            }
        }
        log.info("Badge catalogue synchronised: {} configured, {} inserted, {} updated",
                properties.getBadges().size(), inserted, updated);
    }

    private void validate(EngagementProperties.BadgeDefinition definition, Set<String> seen) {
        if (definition.getKey() == null || definition.getKey().isBlank()) {
            throw new IllegalStateException("Badge definition without a key: " + definition);
        }
        if (!seen.add(definition.getKey())) {
            throw new IllegalStateException("Duplicate badge key in configuration: " + definition.getKey());
        }
        if (definition.getName() == null || definition.getDescription() == null || definition.getCategory() == null) {
            throw new IllegalStateException("Badge " + definition.getKey() + " needs a name, description and category");
        }
        try {
            criteriaParser.parse(definition.getCriteria());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Badge " + definition.getKey() + " has invalid criteria: " + e.getMessage(), e);
        }
    }

    private boolean sameDefinition(Badge badge, EngagementProperties.BadgeDefinition definition) {
        return Objects.equals(badge.getName(), definition.getName())
                && Objects.equals(badge.getDescription(), definition.getDescription())
                && badge.getCategory() == definition.getCategory()
                && Objects.equals(badge.getCriteria(), definition.getCriteria().trim());
    }
}
