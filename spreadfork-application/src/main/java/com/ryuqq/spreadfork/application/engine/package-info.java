/**
 * 엔진 조립.
 *
 * <p>캐시와 레지스트리는 서로를 필요로 하므로
 * {@link com.ryuqq.spreadfork.application.engine.DeferredForkPathResolver}로 연결 시점을
 * 늦춥니다.</p>
 *
 * @since 1.0.0
 * @author Spreadfork Team
 */
package com.ryuqq.spreadfork.application.engine;
