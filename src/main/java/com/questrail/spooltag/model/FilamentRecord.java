package com.questrail.spooltag.model;

import com.questrail.spooltag.tag.TagUid;

import java.util.Objects;
import java.util.Optional;

/**
 * FilamentRecord
 * =============================================================================
 * Structured attributes of a filament spool as stored on its tag.
 *
 * <p>Numeric fields carry the decoded values; range checks against the on-tag
 * representation happen at encode time, not here. {@code hasRsaSignature} is
 * informational: the encoder never writes signature sectors.</p>
 *
 * <p>{@code secondaryColor} is present only for multi-color spools
 * ({@code colorFormat == 2}).</p>
 */
public record FilamentRecord(
        TagUid uid,
        String materialVariantId,
        String materialId,
        String filamentType,
        String detailedFilamentType,
        FilamentColor color,
        int spoolWeightG,
        float filamentDiameterMm,
        int dryingTempC,
        int dryingTimeH,
        int bedTempType,
        int bedTempC,
        int maxHotendTempC,
        int minHotendTempC,
        float nozzleDiameter,
        String trayUid,
        double spoolWidthMm,
        String productionDateTime,
        String shortProductionDateTime,
        int filamentLengthM,
        int colorFormat,
        int colorCount,
        Optional<FilamentColor> secondaryColor,
        boolean hasRsaSignature
) {
    /** Color format value indicating a secondary color in block 16. */
    public static final int COLOR_FORMAT_DUAL = 2;

    public FilamentRecord {
        Objects.requireNonNull(uid, "uid");
        Objects.requireNonNull(materialVariantId, "materialVariantId");
        Objects.requireNonNull(materialId, "materialId");
        Objects.requireNonNull(filamentType, "filamentType");
        Objects.requireNonNull(detailedFilamentType, "detailedFilamentType");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(trayUid, "trayUid");
        Objects.requireNonNull(productionDateTime, "productionDateTime");
        Objects.requireNonNull(shortProductionDateTime, "shortProductionDateTime");
        Objects.requireNonNull(secondaryColor, "secondaryColor");
    }

    public String colorHex() {
        return color.toHex();
    }

    public int colorAlpha() {
        return color.alpha();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withUid(uid)
                .withMaterialVariantId(materialVariantId)
                .withMaterialId(materialId)
                .withFilamentType(filamentType)
                .withDetailedFilamentType(detailedFilamentType)
                .withColor(color)
                .withSpoolWeightG(spoolWeightG)
                .withFilamentDiameterMm(filamentDiameterMm)
                .withDryingTempC(dryingTempC)
                .withDryingTimeH(dryingTimeH)
                .withBedTempType(bedTempType)
                .withBedTempC(bedTempC)
                .withMaxHotendTempC(maxHotendTempC)
                .withMinHotendTempC(minHotendTempC)
                .withNozzleDiameter(nozzleDiameter)
                .withTrayUid(trayUid)
                .withSpoolWidthMm(spoolWidthMm)
                .withProductionDateTime(productionDateTime)
                .withShortProductionDateTime(shortProductionDateTime)
                .withFilamentLengthM(filamentLengthM)
                .withColorFormat(colorFormat)
                .withColorCount(colorCount)
                .withSecondaryColor(secondaryColor.orElse(null))
                .withRsaSignature(hasRsaSignature);
    }

    public static final class Builder {
        private TagUid uid = TagUid.of(new byte[4]);
        private String materialVariantId = "";
        private String materialId = "";
        private String filamentType = "";
        private String detailedFilamentType = "";
        private FilamentColor color = new FilamentColor(0, 0, 0, 0xFF);
        private int spoolWeightG;
        private float filamentDiameterMm = 1.75f;
        private int dryingTempC;
        private int dryingTimeH;
        private int bedTempType;
        private int bedTempC;
        private int maxHotendTempC;
        private int minHotendTempC;
        private float nozzleDiameter;
        private String trayUid = "";
        private double spoolWidthMm;
        private String productionDateTime = "";
        private String shortProductionDateTime = "";
        private int filamentLengthM;
        private int colorFormat;
        private int colorCount;
        private FilamentColor secondaryColor;
        private boolean hasRsaSignature;

        public Builder withUid(TagUid uid) {
            this.uid = uid;
            return this;
        }

        public Builder withMaterialVariantId(String materialVariantId) {
            this.materialVariantId = materialVariantId;
            return this;
        }

        public Builder withMaterialId(String materialId) {
            this.materialId = materialId;
            return this;
        }

        public Builder withFilamentType(String filamentType) {
            this.filamentType = filamentType;
            return this;
        }

        public Builder withDetailedFilamentType(String detailedFilamentType) {
            this.detailedFilamentType = detailedFilamentType;
            return this;
        }

        public Builder withColor(FilamentColor color) {
            this.color = color;
            return this;
        }

        public Builder withSpoolWeightG(int spoolWeightG) {
            this.spoolWeightG = spoolWeightG;
            return this;
        }

        public Builder withFilamentDiameterMm(float filamentDiameterMm) {
            this.filamentDiameterMm = filamentDiameterMm;
            return this;
        }

        public Builder withDryingTempC(int dryingTempC) {
            this.dryingTempC = dryingTempC;
            return this;
        }

        public Builder withDryingTimeH(int dryingTimeH) {
            this.dryingTimeH = dryingTimeH;
            return this;
        }

        public Builder withBedTempType(int bedTempType) {
            this.bedTempType = bedTempType;
            return this;
        }

        public Builder withBedTempC(int bedTempC) {
            this.bedTempC = bedTempC;
            return this;
        }

        public Builder withMaxHotendTempC(int maxHotendTempC) {
            this.maxHotendTempC = maxHotendTempC;
            return this;
        }

        public Builder withMinHotendTempC(int minHotendTempC) {
            this.minHotendTempC = minHotendTempC;
            return this;
        }

        public Builder withNozzleDiameter(float nozzleDiameter) {
            this.nozzleDiameter = nozzleDiameter;
            return this;
        }

        public Builder withTrayUid(String trayUid) {
            this.trayUid = trayUid;
            return this;
        }

        public Builder withSpoolWidthMm(double spoolWidthMm) {
            this.spoolWidthMm = spoolWidthMm;
            return this;
        }

        public Builder withProductionDateTime(String productionDateTime) {
            this.productionDateTime = productionDateTime;
            return this;
        }

        public Builder withShortProductionDateTime(String shortProductionDateTime) {
            this.shortProductionDateTime = shortProductionDateTime;
            return this;
        }

        public Builder withFilamentLengthM(int filamentLengthM) {
            this.filamentLengthM = filamentLengthM;
            return this;
        }

        public Builder withColorFormat(int colorFormat) {
            this.colorFormat = colorFormat;
            return this;
        }

        public Builder withColorCount(int colorCount) {
            this.colorCount = colorCount;
            return this;
        }

        /** May be null for single-color spools. */
        public Builder withSecondaryColor(FilamentColor secondaryColor) {
            this.secondaryColor = secondaryColor;
            return this;
        }

        public Builder withRsaSignature(boolean hasRsaSignature) {
            this.hasRsaSignature = hasRsaSignature;
            return this;
        }

        public FilamentRecord build() {
            return new FilamentRecord(uid, materialVariantId, materialId, filamentType,
                    detailedFilamentType, color, spoolWeightG, filamentDiameterMm,
                    dryingTempC, dryingTimeH, bedTempType, bedTempC, maxHotendTempC,
                    minHotendTempC, nozzleDiameter, trayUid, spoolWidthMm,
                    productionDateTime, shortProductionDateTime, filamentLengthM,
                    colorFormat, colorCount, Optional.ofNullable(secondaryColor),
                    hasRsaSignature);
        }
    }
}
