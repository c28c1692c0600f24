package com.rakshak.honeypot.util;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.en.PorterStemFilter;
import org.apache.lucene.analysis.pattern.PatternReplaceCharFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;

import java.io.Reader;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 詐騙語料 Lucene 記憶體索引
 * <p>
 * 將已知詐騙句型（label=1）與一般對話（label=0）建成同一份索引，
 * 查詢時以 BM25 取回前 K 筆，回傳詐騙文件所佔的分數比例。
 */
public class LuceneScamIndex {

    public record Estimate(float scamScore, float safeScore, int hits) {

        public double probability() {
            float total = scamScore + safeScore;
            return total <= 0f ? 0.0 : scamScore / total;
        }
    }

    private static final String FIELD_TEXT = "text";
    private static final String FIELD_LABEL = "label";
    private static final int LABEL_SCAM = 1;
    private static final int LABEL_SAFE = 0;

    /** 查詢字串上限，避免超長訊息產生過多子句 */
    private static final int MAX_QUERY_CHARS = 1000;

    /** 數字（金額、帳號）不參與相似度計算 */
    private static final Pattern DIGIT_PATTERN = Pattern.compile("\\d+");

    private final Analyzer analyzer;
    private Directory directory;
    private IndexSearcher searcher;

    public LuceneScamIndex() {
        this.analyzer = new Analyzer() {
            @Override
            protected Reader initReader(String fieldName, Reader reader) {
                return new PatternReplaceCharFilter(DIGIT_PATTERN, " ", reader);
            }

            @Override
            protected TokenStreamComponents createComponents(String fieldName) {
                Tokenizer tokenizer = new StandardTokenizer();
                TokenStream stream = new PorterStemFilter(new LowerCaseFilter(tokenizer));
                return new TokenStreamComponents(tokenizer, stream);
            }
        };
    }

    public void build(List<String> scamTexts, List<String> safeTexts) {
        try {
            this.directory = new ByteBuffersDirectory();
            IndexWriterConfig config = new IndexWriterConfig(analyzer);
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);

            try (IndexWriter writer = new IndexWriter(directory, config)) {
                addAll(writer, scamTexts, LABEL_SCAM);
                addAll(writer, safeTexts, LABEL_SAFE);
                writer.commit();
            }

            DirectoryReader reader = DirectoryReader.open(directory);
            this.searcher = new IndexSearcher(reader);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build Lucene scam index", e);
        }
    }

    public int getDocCount() {
        if (searcher == null) {
            return 0;
        }
        return searcher.getIndexReader().numDocs();
    }

    public Estimate estimate(String text, int topK) {
        if (searcher == null || text == null || text.isBlank() || topK <= 0) {
            return new Estimate(0f, 0f, 0);
        }

        String qText = text.strip();
        if (qText.length() > MAX_QUERY_CHARS) {
            qText = qText.substring(0, MAX_QUERY_CHARS);
        }

        QueryParser parser = new QueryParser(FIELD_TEXT, analyzer);
        Query query;
        try {
            query = parser.parse(QueryParser.escape(qText));
        } catch (ParseException e) {
            return new Estimate(0f, 0f, 0);
        }

        try {
            TopDocs topDocs = searcher.search(query, topK);
            float scam = 0f;
            float safe = 0f;
            for (ScoreDoc sd : topDocs.scoreDocs) {
                Document doc = searcher.storedFields().document(sd.doc);
                int label = doc.getField(FIELD_LABEL).numericValue().intValue();
                if (label == LABEL_SCAM) {
                    scam += sd.score;
                } else {
                    safe += sd.score;
                }
            }
            return new Estimate(scam, safe, topDocs.scoreDocs.length);
        } catch (Exception e) {
            return new Estimate(0f, 0f, 0);
        }
    }

    private static void addAll(IndexWriter writer, List<String> texts, int label) throws Exception {
        if (texts == null) {
            return;
        }
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                continue;
            }
            Document doc = new Document();
            doc.add(new StoredField(FIELD_LABEL, label));
            doc.add(new TextField(FIELD_TEXT, text, Field.Store.NO));
            writer.addDocument(doc);
        }
    }
}
