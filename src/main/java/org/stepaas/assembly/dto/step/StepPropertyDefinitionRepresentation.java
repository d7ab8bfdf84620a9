package org.stepaas.assembly.dto.step;

/**
 * {@code PROPERTY_DEFINITION_REPRESENTATION(definition, used_representation)}。
 */
public record StepPropertyDefinitionRepresentation(
        int id,
        Integer definitionRef,
        Integer representationRef
) {
}
