package com.hamclock.rigdaemon.adapter.flrig;

import org.apache.xmlrpc.common.TypeFactoryImpl;
import org.apache.xmlrpc.common.XmlRpcController;
import org.apache.xmlrpc.common.XmlRpcStreamConfig;
import org.apache.xmlrpc.serializer.DoubleSerializer;
import org.apache.xmlrpc.serializer.TypeSerializer;
import org.apache.xmlrpc.serializer.TypeSerializerImpl;
import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;

import java.math.BigDecimal;

/**
 * Writes {@code <double>} values in plain decimal notation.
 * <p>
 * The stock serializer uses {@link Double#toString()}, which renders VFO frequencies in exponent
 * form ({@code 1.40740001E7}); XML-RPC doubles have no exponent and flrig rejects them.
 */
class PlainDoubleTypeFactory extends TypeFactoryImpl {

    private static final TypeSerializer PLAIN_DOUBLE = new TypeSerializerImpl() {
        @Override
        public void write(ContentHandler handler, Object object) throws SAXException {
            write(handler, DoubleSerializer.DOUBLE_TAG, toPlainString((Double) object));
        }
    };

    PlainDoubleTypeFactory(XmlRpcController controller) {
        super(controller);
    }

    @Override
    public TypeSerializer getSerializer(XmlRpcStreamConfig config, Object object) throws SAXException {
        if (object instanceof Double) {
            return PLAIN_DOUBLE;
        }
        return super.getSerializer(config, object);
    }

    static String toPlainString(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }
}
