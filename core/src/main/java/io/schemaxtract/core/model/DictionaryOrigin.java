package io.schemaxtract.core.model;

/**
 * Where the field dictionary places a field inside the host's form hierarchy.
 * Absent for fields that only the layout describes.
 *
 * @param formId            owning form id
 * @param panelId           owning panel id
 * @param sectionId         owning section id
 * @param location          location name
 * @param formManagerNodeId "no data" node id
 * @param presetValueId     preset value definition id
 */
public record DictionaryOrigin(
        String formId,
        String panelId,
        String sectionId,
        String location,
        String formManagerNodeId,
        String presetValueId) {}
