package com.astrobg.service;

import com.astrobg.model.BackgroundModel;
import com.astrobg.model.ImageData;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FitsImageServiceTest {

    private final FitsImageService service = new FitsImageService();

    @TempDir
    Path tmp;

    @Test
    void singleChannelImageSurvivesAWriteAndRead() throws Exception {
        float[] px = {0.1f, 0.2f, 0.3f, 0.4f, 0.5f, 0.6f};
        File file = tmp.resolve("mono.fits").toFile();

        service.write(file, 3, 2, 1, px);
        ImageData image = service.read(file);

        assertEquals(3, image.width);
        assertEquals(2, image.height);
        assertEquals(1, image.channels);
        assertEquals(0.6f, image.pixel(2, 1, 0), 0f);
        assertArrayEquals(px, image.pixels, 0f);
    }

    @Test
    void cubeIsReadAsPlanarChannels() throws Exception {
        float[] px = new float[3 * 4 * 2];
        for (int i = 0; i < px.length; i++) px[i] = i;
        File file = tmp.resolve("rgb.fits").toFile();

        service.write(file, 4, 2, 3, px);
        ImageData image = service.read(file);

        assertEquals(3, image.channels);
        assertEquals(4, image.width);
        assertEquals(2, image.height);
        assertEquals(8 + 4 + 1, image.pixel(1, 1, 1), 0f);
    }

    @Test
    void integerDataIsConvertedToFloat() throws Exception {
        File file = tmp.resolve("int.fits").toFile();
        try (Fits fits = new Fits()) {
            fits.addHDU(Fits.makeHDU(new short[][] {{1, 2}, {300, -4}}));
            fits.write(file);
        }

        ImageData image = service.read(file);

        assertEquals(300f, image.pixel(0, 1, 0), 0f);
        assertEquals(-4f, image.pixel(1, 1, 0), 0f);
    }

    @Test
    void unsupportedKernelIsRejected() throws Exception {
        File file = tmp.resolve("long.fits").toFile();
        try (Fits fits = new Fits()) {
            fits.addHDU(Fits.makeHDU(new long[][] {{1L, 2L}, {3L, 4L}}));
            fits.write(file);
        }

        assertThrows(FitsException.class, () -> service.read(file));
    }

    @Test
    void backgroundModelIsWrittenWithItsShape() throws Exception {
        BackgroundModel model = new BackgroundModel(5, 4, 1);
        model.setPlane(0, new float[20]);
        File file = tmp.resolve("background.fits").toFile();

        service.writeBackground(file, model);

        ImageData image = service.read(file);
        assertEquals(5, image.width);
        assertEquals(4, image.height);
    }

    @Test
    void wrongBufferLengthIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> service.write(tmp.resolve("bad.fits").toFile(), 4, 4, 1, new float[3]));
    }
}
