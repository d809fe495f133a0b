package imagecorpus.reorganizer;

import java.util.Locale;
import java.util.Objects;

/**
 * One metadata row: the file to relocate and the model lineage that decides where it goes.
 * Fields are already trimmed; blank and {@code nan} placeholders are replaced by {@link #UNKNOWN}.
 */
public final class MetadataRecord {

    public static final String UNKNOWN = "Unknown";
    static final String LORA = "lora";

    private final String filename;
    private final String baseModel;
    private final String modelName;
    private final String modelType;
    private final long row;

    public MetadataRecord(String filename, String baseModel, String modelName, String modelType) {
        this(filename, baseModel, modelName, modelType, -1);
    }

    MetadataRecord(String filename, String baseModel, String modelName, String modelType, long row) {
        this.filename = Objects.requireNonNull(filename, "filename");
        this.baseModel = orUnknown(baseModel);
        this.modelName = orUnknown(modelName);
        this.modelType = orUnknown(modelType);
        this.row = row;
    }

    /** Replaces missing values and the {@code nan} placeholder (any case) with {@link #UNKNOWN}. */
    static String orUnknown(String value) {
        if (value == null) return UNKNOWN;
        String v = value.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("nan")) return UNKNOWN;
        return v;
    }

    public String getFilename() { return filename; }
    public String getBaseModel() { return baseModel; }
    public String getModelName() { return modelName; }
    public String getModelType() { return modelType; }

    /** 1-based row in the metadata file (the header is row 1), or -1 when built in code. */
    public long getRow() { return row; }

    public boolean isLora() {
        return modelType.toLowerCase(Locale.ROOT).equals(LORA);
    }

    /** Second taxonomy level: the base model for LORA rows, the model name otherwise. */
    public String getEffectiveModel() {
        return isLora() ? baseModel : modelName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataRecord other)) return false;
        return filename.equals(other.filename)
            && baseModel.equals(other.baseModel)
            && modelName.equals(other.modelName)
            && modelType.equals(other.modelType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, baseModel, modelName, modelType);
    }

    @Override
    public String toString() {
        return "MetadataRecord{" + filename + ", base=" + baseModel + ", model=" + modelName
            + ", type=" + modelType + "}";
    }
}
