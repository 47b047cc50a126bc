package io.github.eutro.wasmlink;

import io.github.eutro.wasmlink.types.DefType;
import io.github.eutro.wasmlink.types.ValType;

import java.util.LinkedHashMap;
import java.util.Map;

public class Types {
    public static final DefType.Func FUNC = DefType.Func.of(new ValType[0], new ValType[0]);
    public static final DefType.Func I32_TO_I32 = DefType.Func.of(new ValType[]{ValType.I32}, new ValType[]{ValType.I32});
    public static final DefType.Mem MEMORY = new DefType.Mem(new DefType.Limits(1, null));
    public static final DefType.Global GLOBAL = new DefType.Global(false, ValType.I32);

    public static Map<String, DefType> map(Object... entries) {
        Map<String, DefType> map = new LinkedHashMap<>();
        for (int i = 0; i < entries.length; i += 2) {
            map.put((String) entries[i], (DefType) entries[i + 1]);
        }
        return map;
    }

    public static DefType.Instance instance(Object... entries) {
        return new DefType.Instance(map(entries));
    }

    public static DefType.Module module(DefType.Instance imports, DefType.Instance exports) {
        return new DefType.Module(imports.getExports(), exports.getExports());
    }
}
