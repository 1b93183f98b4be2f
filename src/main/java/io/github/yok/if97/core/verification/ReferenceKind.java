package io.github.yok.if97.core.verification;

/**
 * 参照値の種類です。
 */
public enum ReferenceKind {

    /**
     * 圧力・温度を指定した単相の物性値です。
     */
    PT,

    /**
     * 温度を指定した飽和計算です（期待値は飽和圧力）。
     */
    SAT_T,

    /**
     * 圧力を指定した飽和計算です（期待値は飽和温度）。
     */
    SAT_P
}
