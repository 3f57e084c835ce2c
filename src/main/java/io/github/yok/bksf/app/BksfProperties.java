package io.github.yok.bksf.app;

import io.github.yok.bksf.core.convert.DoubleExcitationSign;
import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * bksf-mapper の設定値（bksf.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "bksf")
public class BksfProperties {

    /**
     * 入力設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * 写像設定です。
     */
    @Valid
    private Mapping mapping = new Mapping();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "bksf")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Input i = getInput();
        Mapping m = getMapping();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(128).append(nl);

        appendSection(sb, nl, "input",
                // file: フェルミオン演算子の CSV
                "file", i.getFile());

        appendSection(sb, nl, "mapping",
                // doubleExcitationSign: 2 体励起の最終項 BpBqBrBs の符号
                "doubleExcitationSign", m.getDoubleExcitationSign(),
                // simplifyTolerance: 係数をゼロとみなす絶対許容誤差
                "simplifyTolerance", m.getSimplifyTolerance());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int k = 0; k < kvPairs.length; k += 2) {
            String key = String.valueOf(kvPairs[k]);
            Object val = (k + 1 < kvPairs.length) ? kvPairs[k + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Input {

        /**
         * フェルミオン演算子の CSV（ヘッダ label,real,imag）です。
         */
        @NotEmpty
        private String file;
    }

    @Data
    public static class Mapping {

        /**
         * 2 体励起の最終項の符号です。
         */
        @NotNull
        private DoubleExcitationSign doubleExcitationSign = DoubleExcitationSign.NEGATIVE;

        /**
         * 同類項をまとめた後に係数をゼロとみなす絶対許容誤差です。
         */
        @PositiveOrZero
        private double simplifyTolerance = 1e-8;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
