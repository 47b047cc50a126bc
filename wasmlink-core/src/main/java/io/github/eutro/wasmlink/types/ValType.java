package io.github.eutro.wasmlink.types;

import java.util.Locale;

/**
 * An enum that represents a WebAssembly value type, and gives its binary-format type code.
 *
 * <blockquote>
 *   <table>
 *     <caption>Binary codes of current WebAssembly valtypes</caption>
 *     <tr><td>WebAssembly ValType</td><td>Code</td></tr>
 *     <tr><td>i32</td><td>{@code 0x7F}</td></tr>
 *     <tr><td>i64</td><td>{@code 0x7E}</td></tr>
 *     <tr><td>f32</td><td>{@code 0x7D}</td></tr>
 *     <tr><td>f64</td><td>{@code 0x7C}</td></tr>
 *     <tr><td>v128</td><td>{@code 0x7B}</td></tr>
 *     <tr><td>funcref</td><td>{@code 0x70}</td></tr>
 *     <tr><td>externref</td><td>{@code 0x6F}</td></tr>
 *   </table>
 * </blockquote>
 */
public enum ValType {
    /**
     * A 32-bit integer.
     */
    I32((byte) 0x7F),
    /**
     * A 64-bit integer.
     */
    I64((byte) 0x7E),
    /**
     * A 32-bit floating-point value.
     */
    F32((byte) 0x7D),
    /**
     * A 64-bit floating-point value.
     */
    F64((byte) 0x7C),
    /**
     * A 128-bit vector.
     */
    V128((byte) 0x7B),
    /**
     * A function reference.
     */
    FUNCREF((byte) 0x70),
    /**
     * An external reference.
     */
    EXTERNREF((byte) 0x6F),
    ;

    private final byte opcode;

    ValType(byte opcode) {
        this.opcode = opcode;
    }

    /**
     * Get the {@link ValType} for a given WebAssembly type code, such as {@code 0x7F} for {@link #I32}.
     *
     * @param opcode The type code.
     * @return The value type.
     * @throws IllegalArgumentException If the code is not that of a value type.
     */
    public static ValType fromOpcode(byte opcode) {
        switch (opcode) {
            case 0x7F:
                return I32;
            case 0x7E:
                return I64;
            case 0x7D:
                return F32;
            case 0x7C:
                return F64;
            case 0x7B:
                return V128;
            case 0x70:
                return FUNCREF;
            case 0x6F:
                return EXTERNREF;
            default:
                throw new IllegalArgumentException(String.format("Not a value type: 0x%02x", opcode));
        }
    }

    /**
     * Get whether this is a reference type, and thus a valid table element type.
     *
     * @return Whether this is a reference type.
     */
    public boolean isReference() {
        return this == FUNCREF || this == EXTERNREF;
    }

    /**
     * Get the opcode byte for this type.
     *
     * @return The WebAssembly type code.
     */
    public byte getOpcode() {
        return opcode;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
