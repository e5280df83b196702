package edu.colorado.clear.vn.common.xml;

public final class XMLText extends XMLContent {

    /**
     * 
     */
    private static final long serialVersionUID = 1L;

    final String text;

    public XMLText(String text) {
        if (text==null)
            throw new NullPointerException("text");
        this.text = text;
    }

    @Override
    public boolean isText() {
        return true;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj) return true;
        if (!(obj instanceof XMLText)) return false;
        return text.equals(((XMLText)obj).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return '"'+text+'"';
    }
}
