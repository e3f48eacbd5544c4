package com.jcss.pipeline;

import java.util.Objects;

/**
 * The single form a registered transform unit is stored in. The variant says how
 * the pipeline learns that the unit is finished.
 */
public sealed interface TransformUnit {
    record Sync(Transform transform) implements TransformUnit {
        public Sync {
            Objects.requireNonNull(transform, "transform");
        }
    }

    record Async(AsyncTransform transform) implements TransformUnit {
        public Async {
            Objects.requireNonNull(transform, "transform");
        }
    }

    record Callback(CallbackTransform transform) implements TransformUnit {
        public Callback {
            Objects.requireNonNull(transform, "transform");
        }
    }

    static TransformUnit of(Transform transform) {
        return new Sync(transform);
    }

    static TransformUnit async(AsyncTransform transform) {
        return new Async(transform);
    }

    static TransformUnit callback(CallbackTransform transform) {
        return new Callback(transform);
    }

    /**
     * Normalizes any accepted registration form. A provider is unwrapped first, even
     * when the same object is a transform itself.
     *
     * @throws IllegalArgumentException when the value is none of the accepted forms
     */
    static TransformUnit from(Object candidate) {
        if (candidate instanceof PluginProvider provider) {
            TransformUnit unit = provider.plugin();
            if (unit == null) {
                throw new IllegalArgumentException("Plugin provider returned no transform unit: " + provider);
            }
            return unit;
        }
        if (candidate instanceof TransformUnit unit) {
            return unit;
        }
        if (candidate instanceof Transform transform) {
            return new Sync(transform);
        }
        if (candidate instanceof AsyncTransform transform) {
            return new Async(transform);
        }
        if (candidate instanceof CallbackTransform transform) {
            return new Callback(transform);
        }
        throw new IllegalArgumentException("Unsupported transform unit: " + candidate);
    }
}
