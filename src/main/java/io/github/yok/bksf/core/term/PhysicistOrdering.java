package io.github.yok.bksf.core.term;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * モード番号昇順に並んだ 4 因子を、物理学者順（生成 2 個 → 消滅 2 個）へ並べ替えるクラスです。
 *
 * <p>
 * 入力の種別列は 3 通りのみを受け付け、並べ替えで生じる位相（±1）を併せて返します。
 * </p>
 */
public final class PhysicistOrdering {

    private PhysicistOrdering() {
    }

    /**
     * 4 因子を物理学者順へ並べ替えます。
     *
     * @param factors 数演算子を展開済みの、モード番号昇順の 4 因子です
     * @return 並べ替え後の因子列と位相です
     * @throws IllegalArgumentException 種別列が想定外の場合に発生します
     */
    public static Reordered reorder(List<Factor> factors) {
        String kinds = factors.stream().map(f -> String.valueOf(f.getKind().symbol()))
                .collect(Collectors.joining());
        Pattern pattern = Pattern.of(kinds);
        if (pattern == null) {
            throw new IllegalArgumentException("想定外の演算子の並びです: " + factors);
        }
        Factor[] out = new Factor[4];
        for (int k = 0; k < 4; k++) {
            out[k] = factors.get(pattern.permutation[k]);
        }
        return new Reordered(List.of(out), pattern.phase);
    }

    /**
     * 受け付ける種別列と、対応する並べ替え・位相です。
     */
    private enum Pattern {

        RAISE_RAISE_LOWER_LOWER("++--", new int[] {0, 1, 2, 3}, 1),

        RAISE_LOWER_RAISE_LOWER("+-+-", new int[] {0, 2, 1, 3}, -1),

        RAISE_LOWER_LOWER_RAISE("+--+", new int[] {0, 3, 1, 2}, 1);

        private final String kinds;

        private final int[] permutation;

        private final int phase;

        Pattern(String kinds, int[] permutation, int phase) {
            this.kinds = kinds;
            this.permutation = permutation;
            this.phase = phase;
        }

        static Pattern of(String kinds) {
            return Arrays.stream(values()).filter(p -> p.kinds.equals(kinds)).findFirst()
                    .orElse(null);
        }
    }

    /**
     * 並べ替え結果です。
     */
    @Value
    public static class Reordered {

        /**
         * 物理学者順の因子列（p+, q+, r-, s-）です。
         */
        List<Factor> factors;

        /**
         * 並べ替えで生じた位相（+1 または -1）です。
         */
        int phase;

        /**
         * 指定位置の因子のモード番号を返します。
         *
         * @param position 位置（0〜3）です
         * @return モード番号です
         */
        public int modeAt(int position) {
            return factors.get(position).getMode();
        }
    }
}
