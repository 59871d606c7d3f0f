package com.wingman.config;

import com.wingman.logging.AppLogger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Thin wrapper around {@link Preferences} holding the folders the user picked last time.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/wingman/analyzer";

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    static PreferencesStore forNode(String node) {
        return new PreferencesStore(Preferences.userRoot().node(node));
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Path::of);
    }

    public void putPath(String key, Path path) {
        if (key == null || key.isBlank() || path == null) return;
        delegate.put(key, path.toAbsolutePath().toString());
        flushQuietly();
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flushQuietly();
    }

    public void remove(String key) {
        delegate.remove(key);
        flushQuietly();
    }

    void clear() {
        try {
            delegate.clear();
            delegate.flush();
        } catch (BackingStoreException ex) {
            AppLogger.get().fine("Could not clear preferences: " + ex.getMessage());
        }
    }

    private void flushQuietly() {
        try {
            delegate.flush();
        } catch (BackingStoreException ex) {
            AppLogger.get().fine("Preferences flush failed: " + ex.getMessage());
        }
    }
}
