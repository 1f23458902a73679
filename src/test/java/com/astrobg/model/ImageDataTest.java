package com.astrobg.model;

import com.astrobg.service.InvalidImageException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImageDataTest {

    @Test
    void pixelsArePlanar() {
        float[] px = new float[2 * 3 * 2];
        for (int i = 0; i < px.length; i++) px[i] = i;
        ImageData image = new ImageData(3, 2, 2, px);

        assertEquals(5f, image.pixel(2, 1, 0), 0f);
        assertEquals(6f + 4f, image.pixel(1, 1, 1), 0f);
        assertArrayEquals(new float[] {6, 7, 8, 9, 10, 11}, image.plane(1), 0f);
    }

    @Test
    void validateNamesTheProblem() {
        InvalidImageException empty = assertThrows(InvalidImageException.class,
                () -> new ImageData(2, 2, 1, new float[0]).validate());
        assertEquals("Image buffer is empty", empty.getMessage());

        assertThrows(InvalidImageException.class, () -> new ImageData(0, 2, 1, new float[2]).validate());
        assertThrows(InvalidImageException.class, () -> new ImageData(2, 2, 0, new float[4]).validate());
        InvalidImageException mismatch = assertThrows(InvalidImageException.class,
                () -> new ImageData(2, 2, 1, new float[5]).validate());
        assertTrue(mismatch.getMessage().startsWith("Buffer holds 5 values"));
        assertFalse(new ImageData(2, 2, 1, new float[5]).isValid());
    }

    @Test
    void copyDoesNotShareTheBuffer() {
        ImageData image = ImageData.singleChannel(2, 1, new float[] {1f, 2f});
        ImageData copy = image.copy();
        copy.pixels[0] = 9f;

        assertEquals(1f, image.pixels[0], 0f);
    }

    @Test
    void rejectionIsOneWay() {
        Sample s = new Sample(1, 1, 0, 0.5f);
        s.reject();
        Sample copy = s.copy();

        assertTrue(copy.isRejected());
        assertEquals(25.0, s.distanceSquared(4, 5), 1e-12);
    }
}
