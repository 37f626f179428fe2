package com.stmtobfuscator.infrastructure.obfuscation.masking;

import com.stmtobfuscator.domain.obfuscation.model.EntityType;
import com.stmtobfuscator.domain.obfuscation.model.PiiEntity;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Dispatches an entity to the mask policy of its type.
 * Types without an entry (UNKNOWN and anything the detector invents) use the fallback mask.
 */
@Component
public class MaskGeneratorRegistry {

    private final Map<EntityType, MaskGenerator> generators;

    public MaskGeneratorRegistry() {
        Map<EntityType, MaskGenerator> map = new EnumMap<>(EntityType.class);
        map.put(EntityType.PERSON_NAME, MaskGenerators::personName);
        map.put(EntityType.ADDRESS, MaskGenerators::address);
        map.put(EntityType.ACCOUNT_NUMBER, MaskGenerators::accountNumber);
        map.put(EntityType.ROUTING_NUMBER, MaskGenerators::routingNumber);
        map.put(EntityType.PHONE_NUMBER, MaskGenerators::phoneNumber);
        map.put(EntityType.EMAIL, MaskGenerators::email);
        map.put(EntityType.ORGANIZATION_NAME, MaskGenerators::organizationName);
        map.put(EntityType.CREDIT_CARD_NUMBER, MaskGenerators::creditCardNumber);
        map.put(EntityType.SSN, MaskGenerators::ssn);
        map.put(EntityType.DATE_OF_BIRTH, MaskGenerators::dateOfBirth);
        map.put(EntityType.IP_ADDRESS, MaskGenerators::ipAddress);
        map.put(EntityType.URL, MaskGenerators::url);
        this.generators = Collections.unmodifiableMap(map);
    }

    /**
     * Mask the entity's text with its type's policy.
     */
    public String mask(PiiEntity entity) {
        return mask(entity.typeName(), entity.text());
    }

    /**
     * @param typeName raw type string; unknown values fall back to the generic mask
     * @param text     text to mask
     * @return the replacement
     */
    public String mask(String typeName, String text) {
        MaskGenerator generator = generators.get(EntityType.fromValue(typeName));
        if (generator == null) {
            return MaskGenerators.fallback(typeName, text);
        }
        return generator.mask(text);
    }

    public boolean hasDedicatedPolicy(EntityType type) {
        return generators.containsKey(type);
    }
}
