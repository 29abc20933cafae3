package com.starsalign.imageOperator;

import com.starsalign.imageAlignment.exception.DegenerateInputException;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bytedeco.opencv.global.opencv_core.*;

class DifferenceEngineTest {

    private static Mat floats(int rows, int cols, float... values) {
        Mat mat = new Mat(rows, cols, CV_32F);
        new FloatPointer(mat.data()).put(values);
        return mat;
    }

    private static float[] read(Mat mat) {
        float[] out = new float[(int) mat.total()];
        try (FloatIndexer idx = mat.createIndexer()) {
            for (int y = 0; y < mat.rows(); y++)
                for (int x = 0; x < mat.cols(); x++)
                    out[y * mat.cols() + x] = idx.get(y, x);
        }
        return out;
    }

    @Test
    void subtractsWithoutClampingOrRescaling() {
        Mat reference = floats(2, 2, 5000f, 10f, -3f, 65000f);
        Mat aligned = floats(2, 2, 4000f, 20f, 0f, 0f);

        Mat diff = DifferenceEngine.difference(reference, aligned);

        assertThat(diff.depth()).isEqualTo(CV_32F);
        assertThat(read(diff)).containsExactly(1000f, -10f, -3f, 65000f);
    }

    @Test
    void unsignedInputsStaySigned() {
        Mat reference = new Mat(1, 2, CV_8U);
        Mat aligned = new Mat(1, 2, CV_8U);
        new BytePointer(reference.data()).put(new byte[]{10, (byte) 200});
        new BytePointer(aligned.data()).put(new byte[]{30, 100});

        Mat diff = DifferenceEngine.difference(reference, aligned);

        assertThat(diff.depth()).isEqualTo(CV_32F);
        assertThat(read(diff)).containsExactly(-20f, 100f);
    }

    @Test
    void rejectsShapeMismatch() {
        assertThatThrownBy(() -> DifferenceEngine.difference(new Mat(4, 4, CV_32F), new Mat(4, 5, CV_32F)))
                .isInstanceOf(DegenerateInputException.class);
    }
}
