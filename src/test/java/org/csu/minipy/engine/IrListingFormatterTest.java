package org.csu.minipy.engine;

import org.csu.minipy.compiler.ir.IrProgram;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IrListingFormatterTest {

    private IrProgram lower(String source) {
        AnalysisResult result = new FrontendProcessor().analyze(source);
        assertTrue(result.isSuccess(), () -> "unexpected failure: " + result.error());
        return result.ir();
    }

    @Test
    void testScopeMapKeepsDeclarationOrder() {
        System.out.println("--- Running test: testScopeMapKeepsDeclarationOrder ---");
        Map<String, List<String>> listing = IrListingFormatter.toMap(lower(
                "def b():\n    return 1\nclass A:\n    def m(self):\n        return 2\nx = b()\n"));

        assertEquals(List.of("<module>", "b", "A.m"), List.copyOf(listing.keySet()));
        assertEquals(List.of("t1 = call b()", "store t1 -> x"), listing.get("<module>"));
        assertEquals(List.of("return 2"), listing.get("A.m"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testRedefinedFunctionsAreAllKept() {
        System.out.println("--- Running test: testRedefinedFunctionsAreAllKept ---");
        Map<String, List<String>> listing = IrListingFormatter.toMap(lower(
                "def f():\n    return 1\ndef f():\n    return 2\n"
                        + "class C:\n    def m(self):\n        return 3\n    def m(self):\n        return 4\n"
                        + "def f():\n    return 5\n"));
        System.out.println("Scopes: " + listing);

        assertEquals(List.of("<module>", "f", "f#2", "C.m", "C.m#2", "f#3"), List.copyOf(listing.keySet()));
        assertEquals(List.of("return 1"), listing.get("f"));
        assertEquals(List.of("return 2"), listing.get("f#2"));
        assertEquals(List.of("return 4"), listing.get("C.m#2"));
        assertEquals(List.of("return 5"), listing.get("f#3"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testFullListing() {
        System.out.println("--- Running test: testFullListing ---");
        String listing = IrListingFormatter.format(lower("def hello(name):\n    return name\nx = hello(1)\n"));
        System.out.println(listing);

        assertEquals("function hello(name):\n"
                + "    return name\n"
                + "\n"
                + "<module>:\n"
                + "    t1 = call hello(1)\n"
                + "    store t1 -> x", listing);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLabelsAreNotIndented() {
        System.out.println("--- Running test: testLabelsAreNotIndented ---");
        String listing = IrListingFormatter.format(lower("def f(a):\n    while a:\n        a = a - 1\n"));
        System.out.println(listing);

        assertEquals("function f(a):\n"
                + "L1:\n"
                + "    if a jump L2\n"
                + "    jump L3\n"
                + "L2:\n"
                + "    t1 = a - 1\n"
                + "    store t1 -> a\n"
                + "    jump L1\n"
                + "L3:", listing);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEmptyProgram() {
        System.out.println("--- Running test: testEmptyProgram ---");
        IrProgram program = lower("");
        assertEquals("", IrListingFormatter.format(program));
        assertEquals(Map.of("<module>", List.of()), IrListingFormatter.toMap(program));
        System.out.println("Result: Test PASSED.\n");
    }
}
