package com.evpn.auditor.transport.netconf;

/**
 * RPC Junos, которые используются аудитом, и сборка сообщений NETCONF вокруг них.
 */
final class JunosRpc {

    static final String BASE_NAMESPACE = "urn:ietf:params:xml:ns:netconf:base:1.0";
    static final String BASE_CAPABILITY = "urn:ietf:params:netconf:base:1.0";

    static final String EVPN_IP_PREFIX_DATABASE = "get-evpn-ip-prefix-database-information";
    static final String RESTART_ROUTING = "restart-routing-process";
    static final String CLOSE_SESSION = "close-session";

    static final String ROUTE_STATUS_ELEMENT = "adv-ip-route-status";

    private JunosRpc() {
    }

    static String clientHello() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<hello xmlns=\"" + BASE_NAMESPACE + "\">"
            + "<capabilities><capability>" + BASE_CAPABILITY + "</capability></capabilities>"
            + "</hello>";
    }

    static String rpc(int messageId, String operation) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<rpc xmlns=\"" + BASE_NAMESPACE + "\" message-id=\"" + messageId + "\">"
            + "<" + operation + "/>"
            + "</rpc>";
    }
}
