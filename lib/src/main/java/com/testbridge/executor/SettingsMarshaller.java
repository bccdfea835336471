package com.testbridge.executor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Copies a settings map into an isolated class loader by value.
 *
 * <p>Values are serialized on the driver side and deserialized with classes resolved through
 * the target loader, so the framework only ever sees types it can load itself.
 */
final class SettingsMarshaller {

    private static final Map<String, Class<?>> PRIMITIVES = Map.of(
            "boolean", boolean.class,
            "byte", byte.class,
            "char", char.class,
            "short", short.class,
            "int", int.class,
            "long", long.class,
            "float", float.class,
            "double", double.class,
            "void", void.class);

    private SettingsMarshaller() {
    }

    /**
     * Copies settings into a class loader.
     *
     * @param settings the settings, values must be serializable
     * @param target the loader the copy must live in
     * @return an unmodifiable copy whose values are resolved through the target loader
     * @throws java.io.NotSerializableException if a value cannot be serialized
     * @throws ClassNotFoundException if a value's class is not visible in the target loader
     * @throws IOException if the copy fails for any other stream reason
     */
    static Map<String, Object> marshal(Map<String, Object> settings, ClassLoader target)
            throws IOException, ClassNotFoundException {
        Objects.requireNonNull(target, "target");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(new LinkedHashMap<>(settings));
        }
        try (ObjectInputStream in = new TargetObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()), target)) {
            @SuppressWarnings("unchecked")
            Map<String, Object> copy = (Map<String, Object>) in.readObject();
            return Collections.unmodifiableMap(copy);
        }
    }

    private static final class TargetObjectInputStream extends ObjectInputStream {
        private final ClassLoader target;

        TargetObjectInputStream(InputStream in, ClassLoader target) throws IOException {
            super(in);
            this.target = target;
        }

        @Override
        protected Class<?> resolveClass(ObjectStreamClass desc) throws ClassNotFoundException {
            Class<?> primitive = PRIMITIVES.get(desc.getName());
            if (primitive != null) {
                return primitive;
            }
            return Class.forName(desc.getName(), false, target);
        }
    }
}
