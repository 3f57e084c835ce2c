package io.github.yok.bksf.out;

/**
 * 写像結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 写像結果を出力します。
     *
     * @param report 写像結果と補助情報です
     */
    void write(MappingReport report);
}
