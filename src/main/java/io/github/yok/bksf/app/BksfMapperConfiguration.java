package io.github.yok.bksf.app;

import io.github.yok.bksf.core.mapper.BravyiKitaevSuperFastMapper;
import io.github.yok.bksf.in.CsvFermionicOperatorReader;
import io.github.yok.bksf.in.FermionicOperatorReader;
import io.github.yok.bksf.out.CsvResultWriter;
import io.github.yok.bksf.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * CSV 入力 + BKSF 写像 + CSV 出力の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class BksfMapperConfiguration {

    /**
     * bksf-mapper の設定値（bksf.*）です。
     */
    private final BksfProperties p;

    /**
     * BKSF 写像を生成します。
     *
     * @return BKSF 写像です
     */
    @Bean
    public BravyiKitaevSuperFastMapper bravyiKitaevSuperFastMapper() {
        BksfProperties.Mapping m = p.getMapping();
        return new BravyiKitaevSuperFastMapper(m.getDoubleExcitationSign(),
                m.getSimplifyTolerance());
    }

    /**
     * フェルミオン演算子の入力ロジックを生成します。
     *
     * @return 入力ロジックです
     */
    @Bean
    public FermionicOperatorReader fermionicOperatorReader() {
        return new CsvFermionicOperatorReader(p.getInput().getFile());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
