package io.pulse4j.spi;

public interface DeliveryService {

    /**
     * @throws io.pulse4j.exception.DeliveryException when no channel accepted the content
     */
    void deliver(String content, String contentId, String userContext, String templateRef);
}
