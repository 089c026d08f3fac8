package com.hamclock.rigdaemon.adapter.flrig;

import lombok.extern.slf4j.Slf4j;
import org.apache.xmlrpc.XmlRpcException;
import org.apache.xmlrpc.client.XmlRpcClient;
import org.apache.xmlrpc.client.XmlRpcClientConfigImpl;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;

/**
 * {@link FlrigClient} on top of Apache XML-RPC. flrig serves XML-RPC on {@code http://host:port/}.
 */
@Slf4j
public class ApacheFlrigClient implements FlrigClient {

    private final XmlRpcClient client;

    public ApacheFlrigClient(String host, int port, int timeoutMs) {
        XmlRpcClientConfigImpl config = new XmlRpcClientConfigImpl();
        config.setServerURL(serverUrl(host, port));
        config.setConnectionTimeout(timeoutMs);
        config.setReplyTimeout(timeoutMs);
        config.setEnabledForExtensions(false);

        this.client = new XmlRpcClient();
        this.client.setConfig(config);
        this.client.setTypeFactory(new PlainDoubleTypeFactory(client));
        log.debug("🔧 flrig XML-RPC endpoint: {}", config.getServerURL());
    }

    @Override
    public Object call(String method, Object... params) throws XmlRpcException {
        return client.execute(method, params);
    }

    private static URL serverUrl(String host, int port) {
        try {
            return URI.create("http://" + host + ":" + port + "/").toURL();
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid flrig address " + host + ":" + port, e);
        }
    }
}
