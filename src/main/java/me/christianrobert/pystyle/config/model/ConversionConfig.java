package me.christianrobert.pystyle.config.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Immutable options consumed by a conversion run.
 *
 * <p>Serialized with Jackson in a fixed property order; the serialized form is part of
 * the cache fingerprint, so two equal configurations always produce the same bytes.</p>
 */
@JsonPropertyOrder({"packageName", "indentSize", "addAccessModifiers", "enableTypeInference",
        "cacheCapacity", "addPackageDeclaration"})
public class ConversionConfig {

    public static final String DEFAULT_PACKAGE_NAME = "pythva.generated";
    public static final int DEFAULT_INDENT_SIZE = 4;
    public static final int DEFAULT_CACHE_CAPACITY = 1000;

    private final String packageName;
    private final int indentSize;
    private final boolean addAccessModifiers;
    private final boolean enableTypeInference;
    private final int cacheCapacity;
    private final boolean addPackageDeclaration;

    private ConversionConfig(Builder builder) {
        this.packageName = builder.packageName;
        this.indentSize = builder.indentSize;
        this.addAccessModifiers = builder.addAccessModifiers;
        this.enableTypeInference = builder.enableTypeInference;
        this.cacheCapacity = builder.cacheCapacity;
        this.addPackageDeclaration = builder.addPackageDeclaration;
    }

    public static ConversionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .packageName(packageName)
                .indentSize(indentSize)
                .addAccessModifiers(addAccessModifiers)
                .enableTypeInference(enableTypeInference)
                .cacheCapacity(cacheCapacity)
                .addPackageDeclaration(addPackageDeclaration);
    }

    @JsonProperty("packageName")
    public String getPackageName() {
        return packageName;
    }

    @JsonProperty("indentSize")
    public int getIndentSize() {
        return indentSize;
    }

    @JsonProperty("addAccessModifiers")
    public boolean isAddAccessModifiers() {
        return addAccessModifiers;
    }

    @JsonProperty("enableTypeInference")
    public boolean isEnableTypeInference() {
        return enableTypeInference;
    }

    @JsonProperty("cacheCapacity")
    public int getCacheCapacity() {
        return cacheCapacity;
    }

    @JsonProperty("addPackageDeclaration")
    public boolean isAddPackageDeclaration() {
        return addPackageDeclaration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConversionConfig that = (ConversionConfig) o;
        return indentSize == that.indentSize &&
                addAccessModifiers == that.addAccessModifiers &&
                enableTypeInference == that.enableTypeInference &&
                cacheCapacity == that.cacheCapacity &&
                addPackageDeclaration == that.addPackageDeclaration &&
                Objects.equals(packageName, that.packageName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, indentSize, addAccessModifiers, enableTypeInference,
                cacheCapacity, addPackageDeclaration);
    }

    @Override
    public String toString() {
        return "ConversionConfig{" +
                "packageName='" + packageName + '\'' +
                ", indentSize=" + indentSize +
                ", addAccessModifiers=" + addAccessModifiers +
                ", enableTypeInference=" + enableTypeInference +
                ", cacheCapacity=" + cacheCapacity +
                ", addPackageDeclaration=" + addPackageDeclaration +
                '}';
    }

    public static class Builder {
        private String packageName = DEFAULT_PACKAGE_NAME;
        private int indentSize = DEFAULT_INDENT_SIZE;
        private boolean addAccessModifiers = true;
        private boolean enableTypeInference = true;
        private int cacheCapacity = DEFAULT_CACHE_CAPACITY;
        private boolean addPackageDeclaration = true;

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder indentSize(int indentSize) {
            this.indentSize = indentSize;
            return this;
        }

        public Builder addAccessModifiers(boolean addAccessModifiers) {
            this.addAccessModifiers = addAccessModifiers;
            return this;
        }

        public Builder enableTypeInference(boolean enableTypeInference) {
            this.enableTypeInference = enableTypeInference;
            return this;
        }

        public Builder cacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder addPackageDeclaration(boolean addPackageDeclaration) {
            this.addPackageDeclaration = addPackageDeclaration;
            return this;
        }

        /**
         * @throws IllegalArgumentException if indentSize &lt; 1, cacheCapacity &lt; 0
         *         or the package name is blank while a package declaration is requested
         */
        public ConversionConfig build() {
            if (indentSize < 1) {
                throw new IllegalArgumentException("indentSize must be >= 1, was " + indentSize);
            }
            if (cacheCapacity < 0) {
                throw new IllegalArgumentException("cacheCapacity must be >= 0, was " + cacheCapacity);
            }
            if (addPackageDeclaration && (packageName == null || packageName.trim().isEmpty())) {
                throw new IllegalArgumentException("packageName cannot be empty when addPackageDeclaration is set");
            }
            return new ConversionConfig(this);
        }
    }
}
