package com.yunhwan.rabbit.retry.usecase.retry.port;

import com.yunhwan.rabbit.retry.domain.retry.RetryEnvelope;

public interface RetryEnvelopeCodec {

    byte[] encode(RetryEnvelope envelope);

    /**
     * @throws com.yunhwan.rabbit.retry.common.exception.EnvelopeDecodeException body 가 envelope 형식이 아닐 때
     */
    RetryEnvelope decode(byte[] body);
}
