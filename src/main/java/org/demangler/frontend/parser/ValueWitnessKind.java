package org.demangler.frontend.parser;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The entries of a value witness table, keyed by their two-character code.
 */
public enum ValueWitnessKind {
    ALLOCATE_BUFFER("al", "allocateBuffer"),
    ASSIGN_WITH_COPY("ca", "assignWithCopy"),
    ASSIGN_WITH_TAKE("ta", "assignWithTake"),
    DEALLOCATE_BUFFER("de", "deallocateBuffer"),
    DESTROY("xx", "destroy"),
    DESTROY_BUFFER("XX", "destroyBuffer"),
    INITIALIZE_BUFFER_WITH_COPY_OF_BUFFER("CP", "initializeBufferWithCopyOfBuffer"),
    INITIALIZE_BUFFER_WITH_COPY("Cp", "initializeBufferWithCopy"),
    INITIALIZE_WITH_COPY("cp", "initializeWithCopy"),
    INITIALIZE_BUFFER_WITH_TAKE("Tk", "initializeBufferWithTake"),
    INITIALIZE_WITH_TAKE("tk", "initializeWithTake"),
    PROJECT_BUFFER("pr", "projectBuffer"),
    TYPEOF("ty", "typeof"),
    STORE_EXTRA_INHABITANT("xs", "storeExtraInhabitant"),
    GET_EXTRA_INHABITANT_INDEX("xg", "getExtraInhabitantIndex"),
    GET_ENUM_TAG("ug", "getEnumTag"),
    INPLACE_PROJECT_ENUM_DATA("up", "inplaceProjectEnumData");

    private static final Map<String, ValueWitnessKind> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ValueWitnessKind::code, Function.identity()));

    private final String code;
    private final String displayName;

    ValueWitnessKind(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Finds the witness for a two-character code.
     * @param code The code following the {@code 'w'} discriminator.
     * @return The witness kind, or empty if the code is unknown.
     */
    public static Optional<ValueWitnessKind> forCode(String code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }
}
