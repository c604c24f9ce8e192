package com.ryuqq.commons.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.ryuqq.commons.core.api.ApiResponse;
import com.ryuqq.commons.core.api.PayloadApiResponse;
import com.ryuqq.commons.core.geo.Address;
import com.ryuqq.commons.core.geo.GeoCoordinate;
import com.ryuqq.commons.core.measurement.Distance;
import com.ryuqq.commons.core.measurement.DistanceUnit;
import com.ryuqq.commons.core.measurement.Temperature;
import com.ryuqq.commons.core.measurement.TemperatureRange;
import com.ryuqq.commons.core.measurement.TemperatureUnit;
import com.ryuqq.commons.core.measurement.Volume;
import com.ryuqq.commons.core.measurement.VolumeUnit;
import com.ryuqq.commons.core.measurement.Weight;
import com.ryuqq.commons.core.measurement.WeightUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commons 값 타입용 Jackson Module.
 *
 * <p>등록 대상:</p>
 * <ul>
 *   <li>{@link Distance}, {@link Weight}, {@link Volume}, {@link Temperature}:
 *       {@code {"value", "unit"}} 객체 (정규 단위로 쓰기, 별칭 허용 읽기)</li>
 *   <li>{@link ApiResponse}, {@link PayloadApiResponse}:
 *       {@code {"statusCode", "errorMessage" | "payload"}} 객체</li>
 *   <li>{@link TemperatureRange}, {@link GeoCoordinate}, {@link Address}:
 *       record 기본 매핑 (파생 boolean 속성 제외)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ObjectMapper mapper = new ObjectMapper().registerModule(new CommonsModule());
 * // 또는 ServiceLoader 등록을 통해
 * ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
 * </pre>
 *
 * <p>속성 이름은 ObjectMapper의 {@code PropertyNamingStrategy}를 따르며,
 * {@code MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES}가 켜져 있으면 읽기 시 대소문자를 무시합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CommonsModule extends SimpleModule {

    public static final String MODULE_NAME = "CommonsModule";

    private static final long serialVersionUID = 1L;
    private static final Logger log = LoggerFactory.getLogger(CommonsModule.class);

    /**
     * 생성자.
     *
     * <p>모든 codec을 명시적으로 등록합니다.</p>
     */
    public CommonsModule() {
        super(MODULE_NAME, new Version(1, 0, 0, null, "com.ryuqq", "commons-jackson"));

        addSerializer(new QuantitySerializer<>(
            Distance.class, Distance::getMeters, DistanceUnit.format(DistanceUnit.METER)));
        addDeserializer(Distance.class, new QuantityDeserializer<>(
            Distance.class, DistanceUnit.class, DistanceUnit::fromString, DistanceUnit.METER, Distance::of));

        addSerializer(new QuantitySerializer<>(
            Weight.class, Weight::getGrams, WeightUnit.format(WeightUnit.GRAM)));
        addDeserializer(Weight.class, new QuantityDeserializer<>(
            Weight.class, WeightUnit.class, WeightUnit::fromString, WeightUnit.GRAM, Weight::of));

        addSerializer(new QuantitySerializer<>(
            Volume.class, Volume::getCubicMeters, VolumeUnit.WIRE_SYMBOL));
        addDeserializer(Volume.class, new QuantityDeserializer<>(
            Volume.class, VolumeUnit.class, VolumeUnit::fromString, VolumeUnit.CUBIC_METER, Volume::of));

        addSerializer(new QuantitySerializer<>(
            Temperature.class, Temperature::getKelvin, TemperatureUnit.WIRE_SYMBOL));
        addDeserializer(Temperature.class, new QuantityDeserializer<>(
            Temperature.class, TemperatureUnit.class, TemperatureUnit::fromString, TemperatureUnit.KELVIN,
            Temperature::of));

        addSerializer(new ApiResponseSerializer());
        addDeserializer(ApiResponse.class, new ApiResponseDeserializer());
        addSerializer(new PayloadApiResponseSerializer());
        addDeserializer(PayloadApiResponse.class, new PayloadApiResponseDeserializer());

        setMixInAnnotation(TemperatureRange.class, TemperatureRangeMixin.class);
        setMixInAnnotation(GeoCoordinate.class, GeoCoordinateMixin.class);
        setMixInAnnotation(Address.class, AddressMixin.class);
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        log.info("{} registered: quantity, api response and record codecs", getModuleName());
    }

    abstract static class TemperatureRangeMixin {
        @JsonIgnore
        abstract boolean isSingleTemperature();
    }

    abstract static class GeoCoordinateMixin {
        @JsonIgnore
        abstract boolean isUnknown();
    }

    abstract static class AddressMixin {
        @JsonIgnore
        abstract boolean isEmpty();
    }
}
