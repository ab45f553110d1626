package me.christianrobert.pystyle.transformer.plugin;

import java.util.Objects;

/**
 * Identity of a plugin. The {@code id:version} token is part of the cache fingerprint.
 */
public class PluginDescriptor {

    private final String id;
    private final String version;
    private final String description;

    public PluginDescriptor(String id, String version, String description) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Plugin id cannot be null or empty");
        }
        this.id = id;
        this.version = version != null ? version : "1.0.0";
        this.description = description != null ? description : "";
    }

    public PluginDescriptor(String id, String version) {
        this(id, version, null);
    }

    public String getId() {
        return id;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public String getFingerprintToken() {
        return id + ":" + version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginDescriptor that = (PluginDescriptor) o;
        return id.equals(that.id) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return getFingerprintToken();
    }
}
