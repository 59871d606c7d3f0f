package com.wingman.core.json;

import com.wingman.core.error.MalformedRecordException;
import com.wingman.core.model.SerialNumbers;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Field access over an org.json object that reports presence explicitly. A missing field, a JSON
 * {@code null} and a value of the wrong shape all come back as {@link Optional#empty()}; a wrong
 * shape is additionally noted so the owning record can be flagged partial. Nothing is ever
 * replaced by a sentinel default.
 */
public final class TolerantJson {

    private final JSONObject node;
    private final String context;
    private final List<String> notes;

    private TolerantJson(JSONObject node, String context, List<String> notes) {
        this.node = node;
        this.context = context;
        this.notes = notes;
    }

    public static TolerantJson wrap(JSONObject node, String context, List<String> notes) {
        return new TolerantJson(node == null ? new JSONObject() : node, context, notes);
    }

    public TolerantJson child(JSONObject child, String childContext) {
        return new TolerantJson(child, context.isEmpty() ? childContext : context + "." + childContext, notes);
    }

    public JSONObject node() {
        return node;
    }

    public boolean has(String... keys) {
        return raw(keys).isPresent();
    }

    public Optional<Object> raw(String... keys) {
        for (String key : keys) {
            Object value = node.opt(key);
            if (value != null && value != JSONObject.NULL) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public Optional<String> text(String... keys) {
        Optional<Object> value = raw(keys);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Object v = value.get();
        if (v instanceof String s) {
            String trimmed = s.trim();
            return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
        }
        if (v instanceof Number || v instanceof Boolean) {
            return Optional.of(v.toString());
        }
        note("'%s' is not a text value".formatted(keys[0]));
        return Optional.empty();
    }

    /**
     * Serial numbers and squadron ids arrive as numbers or strings depending on the generator version.
     */
    public Optional<String> identifier(String... keys) {
        Optional<Object> value = raw(keys);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> id = toIdentifier(value.get());
        if (id.isEmpty()) {
            note("'%s' is not an identifier".formatted(keys[0]));
        }
        return id;
    }

    public Optional<Integer> integer(String... keys) {
        Optional<Object> value = raw(keys);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Optional<Integer> parsed = toInteger(value.get());
        if (parsed.isEmpty()) {
            note("'%s' is not an integer".formatted(keys[0]));
        }
        return parsed;
    }

    public Optional<JSONObject> object(String... keys) {
        Optional<Object> value = raw(keys);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (value.get() instanceof JSONObject obj) {
            return Optional.of(obj);
        }
        note("'%s' is not an object".formatted(keys[0]));
        return Optional.empty();
    }

    public Optional<JSONArray> array(String... keys) {
        Optional<Object> value = raw(keys);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (value.get() instanceof JSONArray arr) {
            return Optional.of(arr);
        }
        note("'%s' is not a list".formatted(keys[0]));
        return Optional.empty();
    }

    public void note(String message) {
        notes.add(context.isEmpty() ? message : context + ": " + message);
    }

    public void requirePresent(String label, Optional<?> value) {
        if (value.isEmpty()) {
            note("missing '" + label + "'");
        }
    }

    /**
     * Reads and tokenizes a file. Only an unreadable file or a payload that is not a JSON object or
     * array counts as malformed; everything past that point is handled tolerantly by the loaders.
     */
    public static Object read(Path path) throws MalformedRecordException {
        String content = readText(path);
        if (content.isBlank()) {
            throw new MalformedRecordException(path, "file is empty");
        }
        try {
            JSONTokener tokener = new JSONTokener(content);
            Object value = tokener.nextValue();
            if (!(value instanceof JSONObject) && !(value instanceof JSONArray)) {
                throw new MalformedRecordException(path, "top-level value is neither an object nor a list");
            }
            if (tokener.nextClean() != 0) {
                throw new MalformedRecordException(path, "unexpected content after the top-level value");
            }
            return value;
        } catch (JSONException ex) {
            throw new MalformedRecordException(path, ex.getMessage(), ex);
        }
    }

    /**
     * Unknown top-level shapes degrade to the first object of a list, or to an empty object.
     */
    public static JSONObject rootObject(Object root, List<String> notes) {
        if (root instanceof JSONObject obj) {
            return obj;
        }
        if (root instanceof JSONArray arr) {
            for (int i = 0; i < arr.length(); i++) {
                JSONObject first = arr.optJSONObject(i);
                if (first != null) {
                    notes.add("top-level list instead of object; used the first entry");
                    return first;
                }
            }
        }
        notes.add("no top-level object found");
        return new JSONObject();
    }

    /**
     * Objects held by a list, or by a keyed map. Map entries come back in key order (numeric-aware)
     * so repeated loads enumerate identically.
     */
    public static List<KeyedObject> objectsOf(Object container) {
        List<KeyedObject> result = new ArrayList<>();
        if (container instanceof JSONArray arr) {
            for (int i = 0; i < arr.length(); i++) {
                JSONObject obj = arr.optJSONObject(i);
                if (obj != null) {
                    result.add(new KeyedObject(Optional.empty(), obj));
                }
            }
        } else if (container instanceof JSONObject obj) {
            List<String> keys = new ArrayList<>(obj.keySet());
            keys.sort(SerialNumbers.ORDER);
            for (String key : keys) {
                JSONObject child = obj.optJSONObject(key);
                if (child != null) {
                    result.add(new KeyedObject(Optional.of(key), child));
                }
            }
        }
        return result;
    }

    static Optional<String> toIdentifier(Object value) {
        if (value instanceof String s) {
            String trimmed = s.trim();
            return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
        }
        if (value instanceof Number n) {
            try {
                BigDecimal decimal = new BigDecimal(n.toString());
                if (decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0) {
                    return Optional.of(decimal.toBigInteger().toString());
                }
            } catch (NumberFormatException ignored) {
                // NaN or infinity
            }
        }
        return Optional.empty();
    }

    static Optional<Integer> toInteger(Object value) {
        if (value instanceof Number n) {
            try {
                return Optional.of(new BigDecimal(n.toString()).intValueExact());
            } catch (NumberFormatException | ArithmeticException notAnInt) {
                // fractional, out of int range, NaN or infinity
                return Optional.empty();
            }
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Integer.parseInt(s.trim()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String readText(Path path) throws MalformedRecordException {
        try {
            String content;
            try {
                content = Files.readString(path, StandardCharsets.UTF_8);
            } catch (CharacterCodingException notUtf8) {
                // older generator builds wrote single-byte Latin-1 text
                content = Files.readString(path, StandardCharsets.ISO_8859_1);
            }
            if (!content.isEmpty() && content.charAt(0) == '\uFEFF') {
                content = content.substring(1);
            }
            return content;
        } catch (IOException ex) {
            throw new MalformedRecordException(path, "unreadable: " + ex.getMessage(), ex);
        }
    }

    /**
     * An object found in a list ({@code key} empty) or under a map key.
     */
    public record KeyedObject(Optional<String> key, JSONObject value) {
    }
}
