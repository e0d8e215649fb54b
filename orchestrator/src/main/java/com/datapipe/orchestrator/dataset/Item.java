package com.datapipe.orchestrator.dataset;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One flat record of the pipeline dataset.
 *
 * The first seven fields are written by the generation stage. The others
 * are null until the stage that derives them has run, and are left out of
 * the JSON while null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Item(
        @JsonProperty("id")                 int     id,
        @JsonProperty("name")               String  name,
        @JsonProperty("category")           String  category,
        @JsonProperty("value")              double  value,
        @JsonProperty("quantity")           int     quantity,
        @JsonProperty("is_active")          boolean active,
        @JsonProperty("created_at")         String  createdAt,
        // processing stage
        @JsonProperty("total_value")        Double  totalValue,
        @JsonProperty("processed_by")       String  processedBy,
        @JsonProperty("processed_at")       String  processedAt,
        // transformation stage
        @JsonProperty("is_high_value")      Boolean highValue,
        @JsonProperty("tier")               Tier    tier,
        @JsonProperty("transformed_by")     String  transformedBy,
        @JsonProperty("transformed_at")     String  transformedAt,
        @JsonProperty("category_avg_value") Double  categoryAvgValue
) {

    public static Item generated(int id, String category, double value, int quantity,
                                 boolean active, String createdAt) {
        return new Item(id, "Item " + id, category, value, quantity, active, createdAt,
                null, null, null, null, null, null, null, null);
    }

    public Item withProcessing(double totalValue, String processedBy, String processedAt) {
        return new Item(id, name, category, value, quantity, active, createdAt,
                totalValue, processedBy, processedAt,
                highValue, tier, transformedBy, transformedAt, categoryAvgValue);
    }

    public Item withTransformation(boolean highValue, Tier tier, String transformedBy, String transformedAt) {
        return new Item(id, name, category, value, quantity, active, createdAt,
                totalValue, processedBy, processedAt,
                highValue, tier, transformedBy, transformedAt, categoryAvgValue);
    }

    public Item withCategoryAvgValue(double categoryAvgValue) {
        return new Item(id, name, category, value, quantity, active, createdAt,
                totalValue, processedBy, processedAt,
                highValue, tier, transformedBy, transformedAt, categoryAvgValue);
    }
}
