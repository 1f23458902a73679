package com.astrobg.service;

import com.astrobg.model.BackgroundModel;
import com.astrobg.model.ImageData;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.io.IOException;

/**
 * Reads the primary HDU of a FITS file into {@link ImageData} and writes planar float
 * buffers back out. 2-D kernels are single channel; 3-D cubes are read as [channel][y][x].
 */
public class FitsImageService {

    private static final Logger log = LoggerFactory.getLogger(FitsImageService.class);

    public ImageData read(File fitsFile) throws IOException, FitsException {
        try (Fits fits = new Fits(fitsFile)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new FitsException("No HDU in " + fitsFile.getName());
            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0.0);
            double bscale = header.getDoubleValue("BSCALE", 1.0);

            Object kernel = hdu.getKernel();
            ImageData image;
            if (kernel instanceof Object[] && ((Object[]) kernel).length > 0 && ((Object[]) kernel)[0] instanceof Object[]) {
                Object[] cube = (Object[]) kernel;
                float[][] first = toFloat(cube[0], bzero, bscale);
                int h = first.length, w = first[0].length;
                float[] px = new float[cube.length * w * h];
                for (int c = 0; c < cube.length; c++) {
                    float[][] plane = c == 0 ? first : toFloat(cube[c], bzero, bscale);
                    copyPlane(plane, px, c * w * h);
                }
                image = new ImageData(w, h, cube.length, px);
            } else {
                float[][] plane = toFloat(kernel, bzero, bscale);
                int h = plane.length, w = plane[0].length;
                float[] px = new float[w * h];
                copyPlane(plane, px, 0);
                image = ImageData.singleChannel(w, h, px);
            }
            log.info("Read {} ({}x{}x{})", fitsFile.getName(), image.width, image.height, image.channels);
            return image;
        }
    }

    public void write(File fitsFile, int width, int height, int channels, float[] planar) throws IOException, FitsException {
        if (planar.length != width * height * channels) {
            throw new IllegalArgumentException(String.format(
                    "Buffer holds %d values, expected %dx%dx%d", planar.length, width, height, channels));
        }
        Object data;
        if (channels == 1) {
            data = toRows(planar, 0, width, height);
        } else {
            float[][][] cube = new float[channels][][];
            for (int c = 0; c < channels; c++) cube[c] = toRows(planar, c * width * height, width, height);
            data = cube;
        }

        try (Fits fits = new Fits()) {
            fits.addHDU(Fits.makeHDU(data));
            fits.write(fitsFile);
        }
        log.info("Wrote {} ({}x{}x{})", fitsFile.getName(), width, height, channels);
    }

    public void writeBackground(File fitsFile, BackgroundModel model) throws IOException, FitsException {
        write(fitsFile, model.width, model.height, model.channels, model.toArray());
    }

    public void writeCorrected(File fitsFile, ImageData source, float[] corrected) throws IOException, FitsException {
        write(fitsFile, source.width, source.height, source.channels, corrected);
    }

    private static float[][] toRows(float[] planar, int offset, int width, int height) {
        float[][] rows = new float[height][width];
        for (int y = 0; y < height; y++) System.arraycopy(planar, offset + y * width, rows[y], 0, width);
        return rows;
    }

    private static void copyPlane(float[][] plane, float[] dst, int offset) {
        int w = plane[0].length;
        for (int y = 0; y < plane.length; y++) System.arraycopy(plane[y], 0, dst, offset + y * w, w);
    }

    // Physical value = BZERO + BSCALE * raw, as stored by 16-bit unsigned camera files.
    private static float[][] toFloat(Object k, double bzero, double bscale) throws FitsException {
        if (k instanceof float[][] && bzero == 0.0 && bscale == 1.0) {
            float[][] f = (float[][]) k;
            float[][] d = new float[f.length][];
            for (int i = 0; i < f.length; i++) d[i] = f[i].clone();
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            float[][] d = new float[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = (float) (bzero + bscale * f[i][j]);
            return d;
        }
        if (k instanceof double[][]) {
            double[][] s = (double[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * s[i][j]);
            return d;
        }
        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            float[][] d = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = (float) (bzero + bscale * (s[i][j] & 0xFF));
            return d;
        }
        throw new FitsException("Unsupported FITS image kernel: " + (k == null ? "none" : k.getClass().getSimpleName()));
    }
}
