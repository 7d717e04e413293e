package org.demangler.api;

import com.typesafe.config.Config;

/**
 * Immutable rendering options.
 *
 * @param synthesizeSugarOnTypes Whether standard library collections and optionals are printed with
 *                               their shorthand, e.g. {@code [T]} for {@code Swift.Array<T>}.
 * @param displayTypeOfIVarFieldOffset Whether a field offset record also shows the type of the field.
 */
public record DemangleOptions(boolean synthesizeSugarOnTypes, boolean displayTypeOfIVarFieldOffset) {

    private static final DemangleOptions DEFAULTS = new DemangleOptions(false, true);

    public static DemangleOptions defaults() {
        return DEFAULTS;
    }

    public DemangleOptions withSynthesizeSugarOnTypes(boolean value) {
        return new DemangleOptions(value, displayTypeOfIVarFieldOffset);
    }

    public DemangleOptions withDisplayTypeOfIVarFieldOffset(boolean value) {
        return new DemangleOptions(synthesizeSugarOnTypes, value);
    }

    /**
     * Reads the options from the {@code demangler.options} section of a configuration.
     * Missing keys keep their default values.
     *
     * @param config The root configuration.
     * @return The options.
     */
    public static DemangleOptions fromConfig(Config config) {
        DemangleOptions options = DEFAULTS;
        if (config.hasPath("demangler.options.synthesize-sugar-on-types")) {
            options = options.withSynthesizeSugarOnTypes(config.getBoolean("demangler.options.synthesize-sugar-on-types"));
        }
        if (config.hasPath("demangler.options.display-type-of-ivar-field-offset")) {
            options = options.withDisplayTypeOfIVarFieldOffset(config.getBoolean("demangler.options.display-type-of-ivar-field-offset"));
        }
        return options;
    }
}
