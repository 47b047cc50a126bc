package io.github.eutro.wasmlink.types;

import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

import java.util.*;
import java.util.stream.Stream;

import static io.github.eutro.wasmlink.Types.*;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SubtypingPropertiesTest {
    private static final List<DefType.Instance> INSTANCES = Arrays.asList(
            instance(),
            instance("a", FUNC),
            instance("a", I32_TO_I32),
            instance("b", MEMORY),
            instance("a", FUNC, "b", MEMORY),
            instance("b", MEMORY, "a", FUNC, "c", GLOBAL),
            instance("a", instance()),
            instance("a", instance("a", FUNC)),
            instance("a", instance("a", FUNC, "b", MEMORY)),
            instance("a", FUNC, "b", instance("a", FUNC))
    );

    private static final List<DefType.Module> MODULES = new ArrayList<>();

    static {
        List<DefType.Instance> imports = Arrays.asList(
                instance(),
                instance("a", FUNC),
                instance("a", FUNC, "b", MEMORY),
                instance("a", instance()),
                instance("a", instance("a", FUNC))
        );
        List<DefType.Instance> exports = Arrays.asList(
                instance(),
                instance("a", FUNC),
                instance("a", FUNC, "b", MEMORY)
        );
        for (DefType.Instance i : imports) {
            for (DefType.Instance e : exports) {
                MODULES.add(module(i, e));
            }
        }
        MODULES.add(module(instance("m", module(instance("a", FUNC), instance())), instance()));
        MODULES.add(module(instance("m", module(instance(), instance())), instance()));
    }

    private static Stream<DynamicTest> forEachVariance(String name, PropertyCheck check) {
        return Arrays.stream(Subtyping.values())
                .map(variance -> DynamicTest.dynamicTest(name + " (" + variance + ")", () -> check.run(variance)));
    }

    @TestFactory
    Stream<DynamicTest> reflexivity() {
        return forEachVariance("reflexivity", variance -> {
            for (DefType type : corpus()) {
                assertTrue(variance.isSubtype(type, type), () -> type + " is not a subtype of itself");
            }
        });
    }

    @TestFactory
    Stream<DynamicTest> transitivity() {
        return forEachVariance("transitivity", variance -> {
            checkTransitive(variance, INSTANCES);
            checkTransitive(variance, MODULES);
        });
    }

    @TestFactory
    Stream<DynamicTest> exportMonotonicity() {
        return forEachVariance("export monotonicity", variance -> {
            for (DefType.Instance sub : INSTANCES) {
                DefType.Instance extended = withExtra(sub.getExports());
                for (DefType.Instance sup : INSTANCES) {
                    if (variance.isSubtype(sub, sup)) {
                        assertTrue(variance.isSubtype(extended, sup), () -> extended + " <= " + sup);
                    }
                }
            }
            for (DefType.Module sub : MODULES) {
                DefType.Module extended = new DefType.Module(sub.getImports(), withExtra(sub.getExports()).getExports());
                for (DefType.Module sup : MODULES) {
                    if (variance.isSubtype(sub, sup)) {
                        assertTrue(variance.isSubtype(extended, sup), () -> extended + " <= " + sup);
                    }
                }
            }
        });
    }

    @TestFactory
    Stream<DynamicTest> importAntitonicity() {
        // removing imports only preserves subtyping when imports are contravariant
        Subtyping variance = Subtyping.CONTRAVARIANT;
        return Stream.of(DynamicTest.dynamicTest("import antitonicity", () -> {
            for (DefType.Module sub : MODULES) {
                for (String removed : sub.getImports().keySet()) {
                    Map<String, DefType> imports = new LinkedHashMap<>(sub.getImports());
                    imports.remove(removed);
                    DefType.Module reduced = new DefType.Module(imports, sub.getExports());
                    for (DefType.Module sup : MODULES) {
                        if (variance.isSubtype(sub, sup)) {
                            assertTrue(variance.isSubtype(reduced, sup), () -> reduced + " <= " + sup);
                        }
                    }
                }
            }
        }));
    }

    private static void checkTransitive(Subtyping variance, List<? extends DefType> types) {
        for (DefType a : types) {
            for (DefType b : types) {
                if (!variance.isSubtype(a, b)) continue;
                for (DefType c : types) {
                    if (variance.isSubtype(b, c)) {
                        assertTrue(variance.isSubtype(a, c), () -> a + " <= " + b + " <= " + c);
                    }
                }
            }
        }
    }

    private static DefType.Instance withExtra(Map<String, DefType> exports) {
        Map<String, DefType> extended = new LinkedHashMap<>(exports);
        extended.put("extra", FUNC);
        return new DefType.Instance(extended);
    }

    private static List<DefType> corpus() {
        List<DefType> corpus = new ArrayList<>(INSTANCES);
        corpus.addAll(MODULES);
        corpus.add(FUNC);
        corpus.add(MEMORY);
        corpus.add(GLOBAL);
        return corpus;
    }

    @FunctionalInterface
    private interface PropertyCheck {
        void run(Subtyping variance);
    }
}
