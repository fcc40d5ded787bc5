package com.graphflow.state;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

class DeepCopyTest {

    @Test
    void referenceArray_keepsComponentType() {
        String[] source = {"x", "y"};

        Object copy = DeepCopy.copyValue(source);

        String[] typed = assertInstanceOf(String[].class, copy);
        assertNotSame(source, typed);
        assertArrayEquals(source, typed);
    }

    @Test
    void referenceArray_copiesNestedCollections() {
        List<?>[] source = {new ArrayList<>(List.of(1))};

        List<?>[] copy = (List<?>[]) DeepCopy.copyValue(source);

        assertNotSame(source[0], copy[0]);
        assertEquals(source[0], copy[0]);
    }

    @Test
    void referenceArray_keepsElementWhenCopyDoesNotFitComponentType() {
        HashMap<String, Object> inner = new HashMap<>(Map.of("k", 1));
        HashMap<?, ?>[] source = {inner};

        HashMap<?, ?>[] copy = (HashMap<?, ?>[]) DeepCopy.copyValue(source);

        assertNotSame(source, copy);
        assertSame(inner, copy[0]);
    }

    @Test
    void primitiveArrays_areCloned() {
        char[] chars = {'a'};
        short[] shorts = {1};
        float[] floats = {1.5f};

        char[] charCopy = (char[]) DeepCopy.copyValue(chars);
        short[] shortCopy = (short[]) DeepCopy.copyValue(shorts);
        float[] floatCopy = (float[]) DeepCopy.copyValue(floats);

        assertNotSame(chars, charCopy);
        assertNotSame(shorts, shortCopy);
        assertNotSame(floats, floatCopy);
        assertArrayEquals(chars, charCopy);
        assertArrayEquals(shorts, shortCopy);
        assertArrayEquals(floats, floatCopy, 0f);
    }

    @Test
    void stateContainer_handsTypedArrayBackToReaders() {
        StateContainer state = StateContainer.of(Map.of("arr", new String[]{"x"}));

        String[] arr = (String[]) state.copy().get("arr");

        assertEquals("x", arr[0]);
    }
}
